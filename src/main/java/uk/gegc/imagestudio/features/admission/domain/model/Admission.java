package uk.gegc.imagestudio.features.admission.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;

import java.time.Instant;
import java.util.UUID;

/**
 * A granted admission. Denied attempts leave only an audit record.
 */
@Entity
@Table(name = "admissions",
        indexes = {
                @Index(name = "idx_admission_status_updated", columnList = "status, updated_at"),
                @Index(name = "idx_admission_user_created", columnList = "user_id, created_at")
        })
@Getter
@Setter
public class Admission {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "operation_class", nullable = false, updatable = false, length = 64)
    private String operationClass;

    /**
     * Credits charged; zero for privileged callers.
     */
    @Column(name = "cost", nullable = false, updatable = false)
    private long cost;

    @Column(name = "charge_reference", length = 255)
    private String chargeReference;

    @Column(name = "privileged", nullable = false)
    private boolean privileged;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 16)
    private RiskLevel riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private AdmissionStatus status;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isOwnedBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    public void transitionTo(AdmissionStatus next, Instant now) {
        this.status = next;
        this.updatedAt = now;
        if (next.isTerminal()) {
            this.completedAt = now;
        }
    }
}
