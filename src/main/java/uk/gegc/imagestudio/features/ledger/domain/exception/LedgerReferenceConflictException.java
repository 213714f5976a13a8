package uk.gegc.imagestudio.features.ledger.domain.exception;

/**
 * A reference is already used by an entry of a different kind.
 */
public class LedgerReferenceConflictException extends RuntimeException {

    private final String reference;

    public LedgerReferenceConflictException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
