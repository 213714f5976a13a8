package uk.gegc.imagestudio.features.ledger.domain.model;

public enum ManualReconciliationStatus {
    OPEN,
    RESOLVED
}
