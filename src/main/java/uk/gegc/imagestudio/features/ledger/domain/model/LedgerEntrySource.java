package uk.gegc.imagestudio.features.ledger.domain.model;

public enum LedgerEntrySource {
    ADMISSION,
    PAYMENT,
    SUBSCRIPTION,
    REFUND,
    ADMIN
}
