package uk.gegc.imagestudio.features.ledger.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.imagestudio.features.ledger.application.LedgerMetricsService;
import uk.gegc.imagestudio.features.ledger.application.RefundResult;

import java.util.Locale;

@Slf4j
@Service
public class LedgerMetricsServiceImpl implements LedgerMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter chargedCounter;
    private final Counter chargedCreditsCounter;
    private final Counter chargeRefusedCounter;
    private final Counter chargeWaivedCounter;
    private final Counter integritySuccessCounter;
    private final Counter integrityFailureCounter;
    private final Counter integrityDriftCounter;

    public LedgerMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.chargedCounter = Counter.builder("ledger.charges")
                .description("Charges applied")
                .tag("result", "charged")
                .register(meterRegistry);
        this.chargeRefusedCounter = Counter.builder("ledger.charges")
                .description("Charges refused for insufficient credits")
                .tag("result", "insufficient")
                .register(meterRegistry);
        this.chargeWaivedCounter = Counter.builder("ledger.charges")
                .description("Charges waived for privileged callers")
                .tag("result", "waived")
                .register(meterRegistry);
        this.chargedCreditsCounter = Counter.builder("ledger.credits.charged")
                .description("Credits debited by charges")
                .register(meterRegistry);
        this.integritySuccessCounter = Counter.builder("ledger.integrity.success")
                .description("Accounts whose balance matches their entries")
                .register(meterRegistry);
        this.integrityFailureCounter = Counter.builder("ledger.integrity.failure")
                .description("Accounts that could not be verified")
                .register(meterRegistry);
        this.integrityDriftCounter = Counter.builder("ledger.integrity.drift")
                .description("Accounts whose balance drifted from their entries")
                .register(meterRegistry);
    }

    @Override
    public void incrementCharged(long amount) {
        chargedCounter.increment();
        chargedCreditsCounter.increment(amount);
    }

    @Override
    public void incrementChargeRefused() {
        chargeRefusedCounter.increment();
    }

    @Override
    public void incrementChargeWaived() {
        chargeWaivedCounter.increment();
    }

    @Override
    public void incrementAllocated(String source, long amount) {
        Counter.builder("ledger.allocations")
                .description("Allocations applied")
                .tag("source", source)
                .tag("result", "applied")
                .register(meterRegistry)
                .increment();
        Counter.builder("ledger.credits.allocated")
                .tag("source", source)
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void incrementAllocationDuplicate(String source) {
        Counter.builder("ledger.allocations")
                .tag("source", source)
                .tag("result", "duplicate")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementAllocationConflict(String source) {
        Counter.builder("ledger.allocations")
                .tag("source", source)
                .tag("result", "conflict")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementRefund(RefundResult.Outcome outcome) {
        Counter.builder("ledger.refunds")
                .description("Compensating refunds by result")
                .tag("result", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementManualReconciliationOpened(String reason) {
        log.warn("METRIC: ledger.manual_reconciliations reason={}", reason);
        Counter.builder("ledger.manual_reconciliations")
                .description("Records opened for manual reconciliation")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordIntegrityDrift(String userId, long driftAmount) {
        log.warn("METRIC: ledger.integrity.drift userId={} drift={}", userId, driftAmount);
        integrityDriftCounter.increment();
    }

    @Override
    public void recordIntegritySuccess(String userId) {
        integritySuccessCounter.increment();
    }

    @Override
    public void recordIntegrityFailure(String userId, String reason) {
        log.error("METRIC: ledger.integrity.failure userId={} reason={}", userId, reason);
        integrityFailureCounter.increment();
    }
}
