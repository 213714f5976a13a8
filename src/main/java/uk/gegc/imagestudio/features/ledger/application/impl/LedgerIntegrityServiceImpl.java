package uk.gegc.imagestudio.features.ledger.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.imagestudio.features.ledger.api.dto.IntegrityReportDto;
import uk.gegc.imagestudio.features.ledger.application.LedgerIntegrityService;
import uk.gegc.imagestudio.features.ledger.application.LedgerMetricsService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerAccount;
import uk.gegc.imagestudio.features.ledger.infra.repository.LedgerAccountRepository;
import uk.gegc.imagestudio.features.ledger.infra.repository.LedgerEntryRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * Weekly integrity check of stored balances against completed entries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerIntegrityServiceImpl implements LedgerIntegrityService {

    private final LedgerAccountRepository accountRepository;
    private final LedgerEntryRepository entryRepository;
    private final LedgerMetricsService metricsService;

    @Override
    @Transactional(readOnly = true)
    public IntegrityReportDto verifyAccount(String userId) {
        try {
            var accountOpt = accountRepository.findById(userId);
            long calculated = entryRepository.sumCompletedAmount(userId);
            if (accountOpt.isEmpty()) {
                boolean balanced = calculated == 0;
                return new IntegrityReportDto(userId, balanced, calculated, 0, calculated,
                        "No account found for user");
            }

            long actual = accountOpt.get().getBalance();
            long drift = calculated - actual;
            boolean balanced = drift == 0;
            String details = String.format("Calculated: %d, Actual: %d, Drift: %d", calculated, actual, drift);

            if (balanced) {
                metricsService.recordIntegritySuccess(userId);
            } else {
                metricsService.recordIntegrityDrift(userId, drift);
                log.warn("Ledger drift detected for user {}: {}", userId, details);
            }
            return new IntegrityReportDto(userId, balanced, calculated, actual, drift, details);

        } catch (Exception e) {
            log.error("Error verifying ledger of user {}: {}", userId, e.getMessage(), e);
            metricsService.recordIntegrityFailure(userId, e.getMessage());
            return new IntegrityReportDto(userId, false, 0, 0, 0, "Error during verification: " + e.getMessage());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public IntegritySummary verifyAll() {
        log.info("Starting ledger integrity check for all accounts");

        List<IntegrityReportDto> allResults = new ArrayList<>();
        List<IntegrityReportDto> driftResults = new ArrayList<>();

        for (LedgerAccount account : accountRepository.findAll()) {
            IntegrityReportDto result = verifyAccount(account.getUserId());
            allResults.add(result);
            if (!result.balanced()) {
                driftResults.add(result);
            }
        }

        int total = allResults.size();
        long totalDrift = driftResults.stream().mapToLong(IntegrityReportDto::driftAmount).sum();
        IntegritySummary summary = new IntegritySummary(total, total - driftResults.size(), driftResults.size(),
                totalDrift, driftResults);

        log.info("Integrity check completed: {} accounts, {} balanced, {} with drift, total drift: {}",
                total, summary.balancedAccounts(), summary.accountsWithDrift(), totalDrift);
        return summary;
    }

    /**
     * Sundays at 2 AM unless overridden.
     */
    @Scheduled(cron = "${ledger.integrity-cron:0 0 2 * * SUN}")
    public void performWeeklyIntegrityCheck() {
        try {
            IntegritySummary summary = verifyAll();
            if (!summary.isSuccessful()) {
                log.warn("Weekly integrity check found {} accounts with drift, total drift: {} credits",
                        summary.accountsWithDrift(), summary.totalDriftAmount());
            }
        } catch (Exception e) {
            log.error("Error during weekly integrity check: {}", e.getMessage(), e);
        }
    }
}
