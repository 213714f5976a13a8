package uk.gegc.imagestudio.features.payment.application;

public interface PaymentMetricsService {

    void incrementWebhookReceived(String eventType);

    void incrementWebhookOk(String eventType);

    void incrementWebhookDuplicate(String eventType);

    void incrementWebhookIgnored(String eventType);

    void incrementWebhookFailed(String eventType);

    void incrementInvalidSignature();

    void recordWebhookLatency(String eventType, long latencyMs);

    void recordReconciliation(ReconciliationReport report);
}
