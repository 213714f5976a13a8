package uk.gegc.imagestudio.features.payment.domain.exception;

public class MalformedWebhookPayloadException extends RuntimeException {
    public MalformedWebhookPayloadException(String message) {
        super(message);
    }

    public MalformedWebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
