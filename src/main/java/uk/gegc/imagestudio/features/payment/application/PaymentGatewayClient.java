package uk.gegc.imagestudio.features.payment.application;

import uk.gegc.imagestudio.features.payment.domain.exception.PaymentGatewayException;

import java.util.Map;

/**
 * Outbound calls to the payment gateway. Implementations raise {@link PaymentGatewayException}
 * on transport failures and on responses the gateway marks unsuccessful.
 */
public interface PaymentGatewayClient {

    InitializedTransaction initializeTransaction(TransactionRequest request);

    GatewayTransaction verifyTransaction(String reference);

    /**
     * @param amountMinor amount in the smallest currency unit
     * @param planCode    optional recurring plan to enrol the customer in
     */
    record TransactionRequest(String email, long amountMinor, String currency, String callbackUrl,
                              String planCode, Map<String, Object> metadata) {}

    record InitializedTransaction(String authorizationUrl, String accessCode, String reference) {}

    /**
     * @param status gateway status, e.g. {@code success}, {@code failed}, {@code abandoned}
     */
    record GatewayTransaction(String reference, String status, long amountMinor, String currency,
                              Map<String, Object> metadata) {

        public boolean succeeded() {
            return "success".equalsIgnoreCase(status);
        }

        public boolean terminallyFailed() {
            return "failed".equalsIgnoreCase(status)
                    || "abandoned".equalsIgnoreCase(status)
                    || "reversed".equalsIgnoreCase(status);
        }
    }
}
