package uk.gegc.imagestudio.features.payment.domain.exception;

/**
 * The payment gateway was unreachable or rejected a request.
 */
public class PaymentGatewayException extends RuntimeException {

    private final String gatewayOperation;

    public PaymentGatewayException(String gatewayOperation, String message) {
        super(message);
        this.gatewayOperation = gatewayOperation;
    }

    public PaymentGatewayException(String gatewayOperation, String message, Throwable cause) {
        super(message, cause);
        this.gatewayOperation = gatewayOperation;
    }

    public String getGatewayOperation() {
        return gatewayOperation;
    }
}
