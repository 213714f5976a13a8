package uk.gegc.imagestudio.features.admission.application;

/**
 * @param requestedCost optional; may raise the configured cost of the operation class, never lower it
 */
public record AdmissionRequest(
        String operationClass,
        Long requestedCost,
        String instruction,
        int facesDetected,
        boolean preserveIdentity
) {}
