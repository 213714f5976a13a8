package uk.gegc.imagestudio.features.payment.application;

import java.time.Duration;

/**
 * Settles pending payments the webhook never delivered by asking the gateway for their status.
 */
public interface PaymentReconciliationService {

    /**
     * Examines pending entries created more than {@code lookback} ago, oldest first, up to the
     * configured batch size. Per-entry errors are collected and do not stop the sweep.
     */
    ReconciliationReport reconcile(Duration lookback);
}
