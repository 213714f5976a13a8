package uk.gegc.imagestudio.features.payment.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.application.AllocationResult;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.payment.application.PaymentMetricsService;
import uk.gegc.imagestudio.features.payment.application.PaymentWebhookService;
import uk.gegc.imagestudio.features.payment.application.PaystackProperties;
import uk.gegc.imagestudio.features.payment.application.SubscriptionService;
import uk.gegc.imagestudio.features.payment.application.WebhookLoggingContext;
import uk.gegc.imagestudio.features.payment.application.WebhookSignatureVerifier;
import uk.gegc.imagestudio.features.payment.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.imagestudio.features.payment.domain.exception.MalformedWebhookPayloadException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookServiceImpl implements PaymentWebhookService {

    static final String CHARGE_SUCCESS = "charge.success";
    static final String SUBSCRIPTION_CREATE = "subscription.create";
    static final String SUBSCRIPTION_DISABLE = "subscription.disable";

    private final WebhookSignatureVerifier signatureVerifier;
    private final CreditLedgerService creditLedgerService;
    private final SubscriptionService subscriptionService;
    private final PaystackProperties paystackProperties;
    private final PaymentMetricsService metricsService;
    private final AuditLogWriter auditLogWriter;
    private final ObjectMapper objectMapper;

    @Override
    public Result handle(String rawPayload, String signature) {
        long startTime = System.currentTimeMillis();

        if (!signatureVerifier.verify(rawPayload, signature)) {
            metricsService.incrementInvalidSignature();
            log.warn("Rejected Paystack webhook: {} signature", StringUtils.hasText(signature) ? "invalid" : "missing");
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.UNAUTHORIZED)
                    .action("payment-webhook")
                    .severity(AuditSeverity.WARNING)
                    .status(AuditStatus.FAILURE)
                    .detail("reason", StringUtils.hasText(signature) ? "invalid-signature" : "missing-signature")
                    .detail("payloadLength", rawPayload == null ? 0 : rawPayload.length())
                    .build());
            throw new InvalidWebhookSignatureException("Invalid webhook signature");
        }

        JsonNode event = parse(rawPayload);
        String type = event.path("event").asText(null);
        JsonNode data = event.path("data");
        if (!StringUtils.hasText(type) || !data.isObject()) {
            throw new MalformedWebhookPayloadException("Webhook payload must carry an event name and a data object");
        }

        metricsService.incrementWebhookReceived(type);
        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .eventType(type)
                .reference(data.path("reference").asText(null))
                .build();
        loggingContext.logInfo(log, "Processing Paystack webhook event: {}", type);

        try {
            Result result = switch (type) {
                case CHARGE_SUCCESS -> handleChargeSuccess(data, loggingContext);
                case SUBSCRIPTION_CREATE -> handleSubscriptionCreate(data, loggingContext);
                case SUBSCRIPTION_DISABLE -> handleSubscriptionDisable(data, loggingContext);
                default -> {
                    loggingContext.logInfo(log, "Ignoring Paystack event {} (not handled)", type);
                    yield Result.IGNORED;
                }
            };

            switch (result) {
                case OK -> metricsService.incrementWebhookOk(type);
                case DUPLICATE -> metricsService.incrementWebhookDuplicate(type);
                case IGNORED -> metricsService.incrementWebhookIgnored(type);
            }
            metricsService.recordWebhookLatency(type, System.currentTimeMillis() - startTime);
            return result;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(type);
            loggingContext.logError(log, "Failed to process Paystack event {}", type, e);
            throw e;
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private Result handleChargeSuccess(JsonNode data, WebhookLoggingContext loggingContext) {
        String reference = text(data, "reference");
        if (reference == null) {
            loggingContext.logWarn(log, "charge.success without a reference; ignoring");
            return Result.IGNORED;
        }
        String status = text(data, "status");
        if (status != null && !"success".equalsIgnoreCase(status)) {
            loggingContext.logWarn(log, "charge.success for {} carries status {}; ignoring", reference, status);
            return Result.IGNORED;
        }

        JsonNode metadata = metadata(data);
        Optional<LedgerEntryDto> pending = creditLedgerService.findByReference(reference);

        String userId = text(metadata, "userId");
        if (userId == null) {
            userId = pending.map(LedgerEntryDto::userId).orElse(null);
        }
        loggingContext.setUserId(userId);
        if (userId == null) {
            loggingContext.logError(log, "Payment {} has no userId and no checkout record; ignoring", reference);
            return Result.IGNORED;
        }

        String planId = text(metadata, "planId");
        loggingContext.setPlanId(planId);
        long credits = resolveCredits(metadata, pending, planId);
        if (credits <= 0) {
            loggingContext.logError(log, "Cannot determine credits for payment {}; ignoring", reference);
            return Result.IGNORED;
        }

        LedgerEntrySource source = pending.map(LedgerEntryDto::source)
                .orElse(planId != null ? LedgerEntrySource.SUBSCRIPTION : LedgerEntrySource.PAYMENT);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("gateway", "paystack");
        meta.put("event", CHARGE_SUCCESS);
        if (data.hasNonNull("amount")) {
            meta.put("amountMinor", data.path("amount").asLong());
        }
        putIfPresent(meta, "currency", text(data, "currency"));
        putIfPresent(meta, "packageId", text(metadata, "packageId"));
        putIfPresent(meta, "planId", planId);

        AllocationResult result = creditLedgerService.allocate(userId, credits, reference, source, meta);
        return switch (result.outcome()) {
            case APPLIED -> {
                loggingContext.logInfo(log, "Allocated {} credits for payment {}", result.amount(), reference);
                yield Result.OK;
            }
            case DUPLICATE -> {
                loggingContext.logInfo(log, "Payment {} already allocated", reference);
                yield Result.DUPLICATE;
            }
            case CONFLICT -> {
                // Escalated by the ledger; acknowledging stops redelivery.
                loggingContext.logWarn(log, "Payment {} conflicts with a failed entry; escalated", reference);
                yield Result.OK;
            }
        };
    }

    private long resolveCredits(JsonNode metadata, Optional<LedgerEntryDto> pending, String planId) {
        long credits = metadata.path("credits").asLong(0);
        if (credits > 0) {
            return credits;
        }
        if (pending.isPresent()) {
            return pending.get().amount();
        }
        if (planId != null) {
            return paystackProperties.findPlan(planId).map(PaystackProperties.CatalogItem::getCredits).orElse(0L);
        }
        return paystackProperties.findPackage(text(metadata, "packageId"))
                .map(PaystackProperties.CatalogItem::getCredits)
                .orElse(0L);
    }

    private Result handleSubscriptionCreate(JsonNode data, WebhookLoggingContext loggingContext) {
        String code = firstText(data, "subscription_code", "subscription", "subscription_code");
        JsonNode metadata = metadata(data);
        String userId = text(metadata, "userId");
        if (userId == null) {
            userId = text(metadata(data.path("customer")), "userId");
        }
        String planId = text(metadata, "planId");
        if (planId == null) {
            planId = text(data.path("plan"), "plan_code");
        }
        loggingContext.setSubscriptionCode(code);
        loggingContext.setUserId(userId);
        loggingContext.setPlanId(planId);

        if (code == null || userId == null) {
            loggingContext.logWarn(log, "subscription.create without subscription code or userId; ignoring");
            return Result.IGNORED;
        }
        String email = text(data.path("customer"), "email");
        String emailToken = firstText(data, "email_token", "subscription", "email_token");

        return subscriptionService.activate(code, userId, planId, email, emailToken) ? Result.OK : Result.DUPLICATE;
    }

    private Result handleSubscriptionDisable(JsonNode data, WebhookLoggingContext loggingContext) {
        String code = firstText(data, "subscription_code", "subscription", "subscription_code");
        loggingContext.setSubscriptionCode(code);
        if (code == null) {
            loggingContext.logWarn(log, "subscription.disable without subscription code; ignoring");
            return Result.IGNORED;
        }
        if (subscriptionService.cancel(code)) {
            return Result.OK;
        }
        loggingContext.logInfo(log, "Subscription {} unknown or already cancelled", code);
        return Result.DUPLICATE;
    }

    private JsonNode parse(String rawPayload) {
        try {
            JsonNode node = objectMapper.readTree(rawPayload);
            if (node == null || !node.isObject()) {
                throw new MalformedWebhookPayloadException("Webhook payload must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedWebhookPayloadException("Webhook payload is not valid JSON", e);
        }
    }

    // Paystack sends metadata as an object, or as the JSON string supplied at checkout.
    private JsonNode metadata(JsonNode parent) {
        JsonNode metadata = parent.path("metadata");
        if (metadata.isTextual() && StringUtils.hasText(metadata.asText())) {
            try {
                return objectMapper.readTree(metadata.asText());
            } catch (JsonProcessingException e) {
                log.debug("Ignoring non-JSON metadata string: {}", e.getOriginalMessage());
            }
        }
        return metadata;
    }

    private static String firstText(JsonNode data, String field, String nestedObject, String nestedField) {
        String value = text(data, field);
        return value != null ? value : text(data.path(nestedObject), nestedField);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return StringUtils.hasText(text) ? text : null;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
