package uk.gegc.imagestudio.features.payment.domain.model;

public enum SubscriptionStatus {
    ACTIVE,
    CANCELLED
}
