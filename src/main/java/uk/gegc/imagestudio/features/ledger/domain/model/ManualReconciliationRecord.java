package uk.gegc.imagestudio.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger movement the system could not settle on its own: a failed compensating refund or a
 * payment event that contradicts a failed entry.
 */
@Entity
@Table(name = "manual_reconciliations",
        indexes = @Index(name = "idx_manual_reconciliation_status", columnList = "status, created_at"))
@Getter
@Setter
public class ManualReconciliationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "reference", nullable = false, length = 255)
    private String reference;

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ManualReconciliationStatus status;

    @Column(name = "resolved_by", length = 128)
    private String resolvedBy;

    @Column(name = "resolution_note", length = 1000)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
