package uk.gegc.imagestudio.features.admission.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AdmissionDenialReason {
    RATE_LIMITED("rate-limited"),
    POLICY_VIOLATION("policy-violation"),
    INSUFFICIENT_CREDITS("insufficient-credits");

    private final String wireName;

    AdmissionDenialReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
