package uk.gegc.imagestudio.features.audit.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event types as shown in the admin console. The wire name is kebab-case and stable.
 */
public enum AuditEventType {

    // Admission
    ADMISSION_GRANTED("admission-granted", AuditCategory.IMAGE),
    ADMISSION_FAILED("admission-failed", AuditCategory.IMAGE),
    OPERATION_SUCCEEDED("operation-succeeded", AuditCategory.IMAGE),
    OPERATION_FAILED("operation-failed", AuditCategory.IMAGE),

    // Policy
    POLICY_VIOLATION("policy-violation", AuditCategory.POLICY),

    // Billing
    INSUFFICIENT_CREDITS("billing-insufficient-credits", AuditCategory.BILLING),
    CHARGE_WAIVED("billing-charge-waived", AuditCategory.BILLING),
    CREDITS_ALLOCATED("billing-credits-allocated", AuditCategory.BILLING),
    ALLOCATION_CONFLICT("billing-allocation-conflict", AuditCategory.BILLING),
    CREDITS_REFUNDED("billing-credits-refunded", AuditCategory.BILLING),
    REFUND_ESCALATED("billing-refund-escalated", AuditCategory.BILLING),
    PAYMENT_PENDING("billing-payment-pending", AuditCategory.BILLING),
    PAYMENT_FAILED("billing-payment-failed", AuditCategory.BILLING),
    SUBSCRIPTION_CREATED("billing-subscription-created", AuditCategory.BILLING),
    SUBSCRIPTION_CANCELLED("billing-subscription-cancelled", AuditCategory.BILLING),
    RECONCILIATION_RUN("billing-reconciliation-run", AuditCategory.BILLING),

    // Admin
    ADMIN_CREDITS_ADJUSTED("admin-credits-adjusted", AuditCategory.ADMIN),
    ADMIN_RATE_LIMIT_RESET("admin-rate-limit-reset", AuditCategory.ADMIN),
    ADMIN_RECONCILIATION_RESOLVED("admin-reconciliation-resolved", AuditCategory.ADMIN),

    // Security
    UNAUTHORIZED("security-unauthorized", AuditCategory.SECURITY),
    RATE_LIMIT_EXCEEDED("security-rate-limit-exceeded", AuditCategory.SECURITY);

    private final String wireName;
    private final AuditCategory category;

    AuditEventType(String wireName, AuditCategory category) {
        this.wireName = wireName;
        this.category = category;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public AuditCategory category() {
        return category;
    }

    public static Optional<AuditEventType> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(value) || type.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
