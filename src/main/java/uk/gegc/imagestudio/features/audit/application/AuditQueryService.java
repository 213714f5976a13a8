package uk.gegc.imagestudio.features.audit.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.imagestudio.features.audit.api.dto.AuditRecordDto;
import uk.gegc.imagestudio.features.audit.api.dto.UserActivitySummaryDto;
import uk.gegc.imagestudio.features.audit.domain.model.AuditCategory;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;

import java.time.Instant;

/**
 * Read side of the audit log, for the admin console.
 */
public interface AuditQueryService {

    Page<AuditRecordDto> search(String userId,
                                AuditEventType eventType,
                                AuditCategory category,
                                AuditSeverity severity,
                                Instant dateFrom,
                                Instant dateTo,
                                Pageable pageable);

    UserActivitySummaryDto summarizeUser(String userId);
}
