package uk.gegc.imagestudio.features.payment.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.imagestudio.features.payment.application.PaymentMetricsService;
import uk.gegc.imagestudio.features.payment.application.ReconciliationReport;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentMetricsServiceImpl implements PaymentMetricsService {

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementWebhookReceived(String eventType) {
        webhookCounter("payment.webhooks.received", eventType).increment();
    }

    @Override
    public void incrementWebhookOk(String eventType) {
        webhookCounter("payment.webhooks.ok", eventType).increment();
    }

    @Override
    public void incrementWebhookDuplicate(String eventType) {
        webhookCounter("payment.webhooks.duplicate", eventType).increment();
    }

    @Override
    public void incrementWebhookIgnored(String eventType) {
        webhookCounter("payment.webhooks.ignored", eventType).increment();
    }

    @Override
    public void incrementWebhookFailed(String eventType) {
        log.warn("METRIC: payment.webhooks.failed event={}", eventType);
        webhookCounter("payment.webhooks.failed", eventType).increment();
    }

    @Override
    public void incrementInvalidSignature() {
        log.warn("METRIC: payment.webhooks.invalid_signature");
        Counter.builder("payment.webhooks.invalid_signature")
                .description("Webhook deliveries rejected for a bad signature")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordWebhookLatency(String eventType, long latencyMs) {
        Timer.builder("payment.webhooks.latency")
                .tag("event", tag(eventType))
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordReconciliation(ReconciliationReport report) {
        meterRegistry.counter("payment.reconciliation.reconciled").increment(report.reconciledCount());
        meterRegistry.counter("payment.reconciliation.failed").increment(report.failedCount());
        meterRegistry.counter("payment.reconciliation.errors").increment(report.errors().size());
    }

    private Counter webhookCounter(String name, String eventType) {
        return Counter.builder(name)
                .tag("event", tag(eventType))
                .register(meterRegistry);
    }

    private static String tag(String eventType) {
        return eventType == null ? "unknown" : eventType;
    }
}
