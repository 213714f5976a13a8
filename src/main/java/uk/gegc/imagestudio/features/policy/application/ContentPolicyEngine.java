package uk.gegc.imagestudio.features.policy.application;

import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;

/**
 * Decides whether an edit instruction may run. Pure: no I/O, same input gives the same decision.
 */
public interface ContentPolicyEngine {

    /**
     * Forbidden and high-risk terms are checked first and deny regardless of the image.
     * When faces are present and identity must be preserved, every face-directed clause
     * must be cosmetic.
     */
    PolicyDecision evaluate(String instructionText, int facesDetected, boolean preserveIdentity);
}
