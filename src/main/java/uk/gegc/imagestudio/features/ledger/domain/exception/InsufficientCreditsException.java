package uk.gegc.imagestudio.features.ledger.domain.exception;

public class InsufficientCreditsException extends RuntimeException {

    private final long requiredCredits;
    private final long availableCredits;

    public InsufficientCreditsException(String message, long requiredCredits, long availableCredits) {
        super(message);
        this.requiredCredits = requiredCredits;
        this.availableCredits = availableCredits;
    }

    public long getRequiredCredits() {
        return requiredCredits;
    }

    public long getAvailableCredits() {
        return availableCredits;
    }

    public long getShortfall() {
        return Math.max(0, requiredCredits - availableCredits);
    }
}
