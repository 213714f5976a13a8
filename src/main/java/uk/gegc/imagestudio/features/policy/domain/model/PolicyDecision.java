package uk.gegc.imagestudio.features.policy.domain.model;

import java.util.List;

/**
 * @param reasons     human-readable explanations; empty for an unrestricted allow
 * @param matchedTerm the configured term that triggered the rule, if any
 */
public record PolicyDecision(
        RiskLevel riskLevel,
        boolean allowed,
        List<String> reasons,
        int facesDetected,
        PolicyRule rule,
        String matchedTerm
) {

    public PolicyDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static PolicyDecision allow(RiskLevel riskLevel, int facesDetected, PolicyRule rule) {
        return new PolicyDecision(riskLevel, true, List.of(), facesDetected, rule, null);
    }

    public static PolicyDecision deny(RiskLevel riskLevel, int facesDetected, PolicyRule rule,
                                      String matchedTerm, String reason) {
        return new PolicyDecision(riskLevel, false, List.of(reason), facesDetected, rule, matchedTerm);
    }

    public String primaryReason() {
        return reasons.isEmpty() ? null : reasons.get(0);
    }
}
