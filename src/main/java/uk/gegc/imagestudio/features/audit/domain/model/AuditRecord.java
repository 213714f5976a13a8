package uk.gegc.imagestudio.features.audit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "audit_records", indexes = {
        @Index(name = "idx_audit_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_audit_event_created", columnList = "event_type, created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private AuditEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, updatable = false, length = 16)
    private AuditCategory category;

    @Column(name = "user_id", updatable = false, length = 128)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, updatable = false, length = 16)
    private AuditSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 16)
    private AuditStatus status;

    @Column(name = "action", nullable = false, updatable = false, length = 128)
    private String action;

    @Column(name = "details_json", updatable = false, columnDefinition = "TEXT")
    private String detailsJson;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
