package uk.gegc.imagestudio.features.payment.application;

import uk.gegc.imagestudio.features.payment.api.dto.SubscriptionDto;

import java.util.List;

/**
 * Local mirror of gateway subscriptions, maintained from webhook events.
 */
public interface SubscriptionService {

    /**
     * Creates or re-activates the subscription with the given code.
     *
     * @return false when it was already active for the same user and plan
     */
    boolean activate(String subscriptionCode, String userId, String planId, String customerEmail, String emailToken);

    /**
     * @return false when the subscription is unknown or already cancelled
     */
    boolean cancel(String subscriptionCode);

    List<SubscriptionDto> listForUser(String userId);
}
