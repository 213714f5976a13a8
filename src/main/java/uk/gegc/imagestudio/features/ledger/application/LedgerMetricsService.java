package uk.gegc.imagestudio.features.ledger.application;

/**
 * Counters for ledger movements, exported through Micrometer.
 */
public interface LedgerMetricsService {

    void incrementCharged(long amount);
    void incrementChargeRefused();
    void incrementChargeWaived();

    void incrementAllocated(String source, long amount);
    void incrementAllocationDuplicate(String source);
    void incrementAllocationConflict(String source);

    void incrementRefund(RefundResult.Outcome outcome);
    void incrementManualReconciliationOpened(String reason);

    void recordIntegrityDrift(String userId, long driftAmount);
    void recordIntegritySuccess(String userId);
    void recordIntegrityFailure(String userId, String reason);
}
