package uk.gegc.imagestudio.features.policy.domain.exception;

import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;

public class PolicyViolationException extends RuntimeException {

    private final PolicyDecision decision;

    public PolicyViolationException(PolicyDecision decision) {
        super(decision.primaryReason());
        this.decision = decision;
    }

    public PolicyDecision getDecision() {
        return decision;
    }
}
