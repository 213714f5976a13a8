package uk.gegc.imagestudio.features.payment.application;

import uk.gegc.imagestudio.features.payment.api.dto.CheckoutRequest;
import uk.gegc.imagestudio.features.payment.api.dto.CheckoutResponse;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

public interface CheckoutService {

    /**
     * Opens a gateway transaction for a configured package or plan and records a pending allocation
     * under the gateway's reference. Credits arrive with the {@code charge.success} webhook or the
     * reconciliation sweep, whichever comes first.
     */
    CheckoutResponse initiate(AuthenticatedIdentity identity, CheckoutRequest request);
}
