package uk.gegc.imagestudio.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.application.AllocationResult;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryKind;
import uk.gegc.imagestudio.features.payment.application.PaymentGatewayClient;
import uk.gegc.imagestudio.features.payment.application.PaymentMetricsService;
import uk.gegc.imagestudio.features.payment.application.PaymentReconciliationService;
import uk.gegc.imagestudio.features.payment.application.PaystackProperties;
import uk.gegc.imagestudio.features.payment.application.ReconciliationReport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationServiceImpl implements PaymentReconciliationService {

    private final CreditLedgerService creditLedgerService;
    private final PaymentGatewayClient paymentGatewayClient;
    private final PaystackProperties paystackProperties;
    private final PaymentMetricsService metricsService;
    private final AuditLogWriter auditLogWriter;
    private final Clock clock;

    @Scheduled(cron = "${paystack.reconcile-cron:0 0 * * * *}")
    public void runScheduledReconciliation() {
        reconcile(paystackProperties.getReconcileLookback());
    }

    @Override
    public ReconciliationReport reconcile(Duration lookback) {
        Instant cutoff = clock.instant().minus(lookback);
        int batchSize = Math.max(1, paystackProperties.getReconcileBatchSize());

        int examined = 0;
        int reconciled = 0;
        int failed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();

        // Keyset paging; entries still pending at the gateway stay behind the cursor.
        LedgerEntryDto cursor = null;
        List<LedgerEntryDto> page;
        do {
            page = creditLedgerService.findPendingCreatedBefore(cutoff, cursor, batchSize);
            for (LedgerEntryDto entry : page) {
                if (entry.kind() != LedgerEntryKind.ALLOCATION) {
                    continue;
                }
                examined++;
                String reference = entry.externalReference();
                try {
                    PaymentGatewayClient.GatewayTransaction transaction = paymentGatewayClient.verifyTransaction(reference);
                    if (transaction.succeeded()) {
                        AllocationResult result = creditLedgerService.allocate(
                                entry.userId(), entry.amount(), reference, entry.source(),
                                Map.of("gateway", "paystack", "reconciled", true));
                        if (result.applied()) {
                            reconciled++;
                            log.info("Reconciled payment {}: {} credits for user {}", reference, result.amount(), entry.userId());
                        } else {
                            skipped++;
                        }
                    } else if (transaction.terminallyFailed()) {
                        if (creditLedgerService.markFailed(reference, "Gateway reported " + transaction.status())) {
                            failed++;
                        } else {
                            skipped++;
                        }
                    } else {
                        skipped++;
                        log.debug("Payment {} still {} at the gateway", reference, transaction.status());
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to reconcile payment {}: {}", reference, e.getMessage());
                    errors.add(reference + ": " + e.getMessage());
                }
            }
            if (!page.isEmpty()) {
                cursor = page.get(page.size() - 1);
            }
        } while (page.size() == batchSize);

        ReconciliationReport report = new ReconciliationReport(examined, reconciled, failed, skipped, List.copyOf(errors));
        metricsService.recordReconciliation(report);
        log.info("Payment reconciliation finished: examined={} reconciled={} failed={} skipped={} errors={}",
                examined, reconciled, failed, skipped, errors.size());

        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.RECONCILIATION_RUN)
                .action("reconcile-payments")
                .severity(errors.isEmpty() ? AuditSeverity.INFO : AuditSeverity.WARNING)
                .status(errors.isEmpty() ? AuditStatus.SUCCESS : AuditStatus.FAILURE)
                .detail("lookbackMinutes", lookback.toMinutes())
                .detail("examined", examined)
                .detail("reconciled", reconciled)
                .detail("failed", failed)
                .detail("skipped", skipped)
                .detail("errors", errors.size())
                .build());
        return report;
    }
}
