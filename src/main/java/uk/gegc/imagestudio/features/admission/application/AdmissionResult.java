package uk.gegc.imagestudio.features.admission.application;

import uk.gegc.imagestudio.features.admission.domain.model.AdmissionDenialReason;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateDecision;

import java.util.UUID;

/**
 * Outcome of one admission attempt. Exactly one of the check results is the deciding one; later
 * checks are null when an earlier one denied.
 */
public record AdmissionResult(
        boolean allowed,
        AdmissionDenialReason reason,
        RiskLevel riskLevel,
        UUID admissionId,
        long cost,
        boolean privileged,
        Long balanceAfter,
        RateDecision rateDecision,
        PolicyDecision policyDecision
) {

    public static AdmissionResult rateLimited(RateDecision rate) {
        return new AdmissionResult(false, AdmissionDenialReason.RATE_LIMITED, null, null, 0, false, null, rate, null);
    }

    public static AdmissionResult policyViolation(RateDecision rate, PolicyDecision policy) {
        return new AdmissionResult(false, AdmissionDenialReason.POLICY_VIOLATION, policy.riskLevel(), null, 0,
                false, null, rate, policy);
    }

    public static AdmissionResult insufficientCredits(RateDecision rate, PolicyDecision policy, long cost, Long balance) {
        return new AdmissionResult(false, AdmissionDenialReason.INSUFFICIENT_CREDITS, policy.riskLevel(), null, cost,
                false, balance, rate, policy);
    }

    public static AdmissionResult admitted(UUID admissionId, RateDecision rate, PolicyDecision policy, long cost,
                                           boolean privileged, Long balanceAfter) {
        return new AdmissionResult(true, null, policy.riskLevel(), admissionId, cost, privileged, balanceAfter,
                rate, policy);
    }
}
