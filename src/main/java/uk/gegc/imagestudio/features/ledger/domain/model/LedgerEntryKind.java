package uk.gegc.imagestudio.features.ledger.domain.model;

public enum LedgerEntryKind {
    CHARGE,
    ALLOCATION
}
