package uk.gegc.imagestudio.features.audit.application;

/**
 * Append-only writer for audit records.
 *
 * <p>Writes happen in their own transaction and never throw: a failed write is logged and
 * counted, and the audited operation keeps its outcome.
 */
public interface AuditLogWriter {

    void record(AuditEntry entry);
}
