package uk.gegc.imagestudio.features.ledger.application;

import java.util.UUID;

/**
 * @param manualReconciliationId set when the refund was escalated and the record could be stored
 */
public record RefundResult(
        Outcome outcome,
        Long balanceAfter,
        UUID manualReconciliationId
) {

    public enum Outcome {
        REFUNDED,
        ALREADY_REFUNDED,
        ESCALATED
    }
}
