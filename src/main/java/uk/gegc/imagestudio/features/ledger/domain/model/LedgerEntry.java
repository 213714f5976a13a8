package uk.gegc.imagestudio.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * One credit movement. Charges carry a negative amount, allocations a positive one.
 * Only COMPLETED entries count towards the balance.
 */
@Entity
@Table(name = "ledger_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_ledger_entry_reference", columnNames = "external_reference"),
        indexes = {
                @Index(name = "idx_ledger_entry_user_created", columnList = "user_id, created_at"),
                @Index(name = "idx_ledger_entry_status_created", columnList = "status, created_at")
        })
@Getter
@Setter
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private LedgerEntryKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private LedgerEntrySource source;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "external_reference", nullable = false, updatable = false, length = 255)
    private String externalReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LedgerEntryStatus status;

    @Column(name = "meta_json", columnDefinition = "TEXT")
    private String metaJson;

    @Column(name = "balance_after")
    private Long balanceAfter;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isPending() {
        return status == LedgerEntryStatus.PENDING;
    }

    public void complete(long balanceAfter, Instant now) {
        if (status != LedgerEntryStatus.PENDING) {
            throw new IllegalStateException("Entry " + externalReference + " is already " + status);
        }
        this.status = LedgerEntryStatus.COMPLETED;
        this.balanceAfter = balanceAfter;
        this.completedAt = now;
    }

    public void fail(String reason, Instant now) {
        if (status != LedgerEntryStatus.PENDING) {
            throw new IllegalStateException("Entry " + externalReference + " is already " + status);
        }
        this.status = LedgerEntryStatus.FAILED;
        this.failureReason = reason;
        this.completedAt = now;
    }
}
