package uk.gegc.imagestudio.features.payment.application;

import uk.gegc.imagestudio.features.payment.domain.exception.InvalidWebhookSignatureException;
import uk.gegc.imagestudio.features.payment.domain.exception.MalformedWebhookPayloadException;

public interface PaymentWebhookService {

    enum Result { OK, DUPLICATE, IGNORED }

    /**
     * Verifies and applies one gateway event.
     *
     * @throws InvalidWebhookSignatureException  when the signature is missing or wrong; nothing is applied
     * @throws MalformedWebhookPayloadException when the body is not a well-formed event
     */
    Result handle(String rawPayload, String signature);
}
