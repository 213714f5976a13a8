package uk.gegc.imagestudio.features.audit.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditCategory {
    IMAGE,
    POLICY,
    BILLING,
    ADMIN,
    SECURITY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
