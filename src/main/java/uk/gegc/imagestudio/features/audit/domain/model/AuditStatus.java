package uk.gegc.imagestudio.features.audit.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditStatus {
    SUCCESS,
    FAILURE,
    PENDING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
