package uk.gegc.imagestudio.features.payment.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging context for Paystack webhook processing.
 */
@Data
@Builder
public class WebhookLoggingContext {
    private String eventType;
    private String reference;
    private String userId;
    private String subscriptionCode;
    private String planId;

    public void setMDC() {
        if (eventType != null) MDC.put("paystack_event", eventType);
        if (reference != null) MDC.put("paystack_reference", reference);
        if (userId != null) MDC.put("user_id", userId);
        if (subscriptionCode != null) MDC.put("paystack_subscription", subscriptionCode);
        if (planId != null) MDC.put("plan_id", planId);
    }

    public static void clearMDC() {
        MDC.remove("paystack_event");
        MDC.remove("paystack_reference");
        MDC.remove("user_id");
        MDC.remove("paystack_subscription");
        MDC.remove("plan_id");
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
