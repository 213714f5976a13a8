package uk.gegc.imagestudio.shared.exception;

public class UnknownOperationClassException extends RuntimeException {

    private final String operationClass;

    public UnknownOperationClassException(String operationClass) {
        super("Unknown operation class: " + operationClass);
        this.operationClass = operationClass;
    }

    public String getOperationClass() {
        return operationClass;
    }
}
