package uk.gegc.imagestudio.features.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.imagestudio.features.audit.domain.model.AuditCategory;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AuditRecordDto", description = "Immutable audit record with scrubbed details")
public record AuditRecordDto(
        @Schema(description = "Record identifier")
        UUID id,

        @Schema(description = "Event type (kebab-case)", example = "policy-violation")
        AuditEventType eventType,

        @Schema(description = "Event category", example = "policy")
        AuditCategory category,

        @Schema(description = "User the event concerns; absent for anonymous callers")
        String userId,

        @Schema(description = "Severity", example = "warning")
        AuditSeverity severity,

        @Schema(description = "Outcome", example = "failure")
        AuditStatus status,

        @Schema(description = "Action that was audited", example = "admit:edit")
        String action,

        @Schema(description = "Scrubbed details as a JSON document")
        String details,

        @Schema(description = "Correlation id of the originating request")
        String correlationId,

        @Schema(description = "When the record was written")
        Instant createdAt
) {
}
