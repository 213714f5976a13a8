package uk.gegc.imagestudio.features.admission.domain.model;

public enum AdmissionStatus {
    /** Charged and handed to the external operation; outcome not reported yet. */
    ADMITTED,
    SUCCEEDED,
    /** Operation failed; the compensating refund has not settled yet. */
    FAILED,
    REFUNDED,
    /** The refund could not be applied and waits in the manual reconciliation queue. */
    REFUND_ESCALATED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == REFUNDED || this == REFUND_ESCALATED;
    }
}
