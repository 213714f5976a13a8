package uk.gegc.imagestudio.features.audit.application;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;

import java.util.Map;

/**
 * An audit event before sanitization. Details may contain raw user text; the writer scrubs it.
 */
@Value
@Builder
public class AuditEntry {
    AuditEventType eventType;
    String userId;
    String action;
    @Builder.Default
    AuditSeverity severity = AuditSeverity.INFO;
    @Builder.Default
    AuditStatus status = AuditStatus.SUCCESS;
    @Singular("detail")
    Map<String, Object> details;
}
