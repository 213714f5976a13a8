package uk.gegc.imagestudio.features.ledger.domain.model;

public enum LedgerEntryStatus {
    PENDING,
    COMPLETED,
    FAILED
}
