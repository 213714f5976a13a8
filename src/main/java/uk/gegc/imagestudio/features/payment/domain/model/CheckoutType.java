package uk.gegc.imagestudio.features.payment.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CheckoutType {
    /** One-off credit package. */
    CREDIT_PURCHASE,
    /** Recurring plan. */
    SUBSCRIPTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
