package uk.gegc.imagestudio.features.policy.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The rule that produced a policy decision.
 */
public enum PolicyRule {
    INSTRUCTION_TOO_LONG("instruction-too-long"),
    FORBIDDEN_TERM("forbidden-term"),
    HIGH_RISK_TERM("high-risk-term"),
    FACE_EDIT_NOT_COSMETIC("face-edit-not-cosmetic"),
    FACE_EDIT_COSMETIC("face-edit-cosmetic"),
    NO_RESTRICTION("no-restriction");

    private final String wireName;

    PolicyRule(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
