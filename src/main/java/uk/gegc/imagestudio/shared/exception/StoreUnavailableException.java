package uk.gegc.imagestudio.shared.exception;

/**
 * Raised when the backing store could not complete an operation, after any retries.
 * Callers treat this as a denial: nothing is admitted, charged or allocated on this path.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store operation '" + operation + "' failed", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
