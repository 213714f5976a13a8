package uk.gegc.imagestudio.features.ledger.application;

import java.util.UUID;

public record AllocationResult(
        Outcome outcome,
        String userId,
        long amount,
        UUID entryId,
        Long balanceAfter
) {

    public enum Outcome {
        /** Credits were added by this call. */
        APPLIED,
        /** The reference was already completed; nothing changed. */
        DUPLICATE,
        /** The reference belongs to a failed entry; escalated for manual review. */
        CONFLICT
    }

    public boolean applied() {
        return outcome == Outcome.APPLIED;
    }
}
