package uk.gegc.imagestudio.features.ledger.application;

import uk.gegc.imagestudio.features.ledger.api.dto.IntegrityReportDto;

import java.util.List;

/**
 * Checks that each stored balance equals the sum of the account's completed entries.
 */
public interface LedgerIntegrityService {

    IntegrityReportDto verifyAccount(String userId);

    IntegritySummary verifyAll();

    record IntegritySummary(
            int totalAccounts,
            int balancedAccounts,
            int accountsWithDrift,
            long totalDriftAmount,
            List<IntegrityReportDto> driftResults
    ) {
        public boolean isSuccessful() {
            return accountsWithDrift == 0;
        }
    }
}
