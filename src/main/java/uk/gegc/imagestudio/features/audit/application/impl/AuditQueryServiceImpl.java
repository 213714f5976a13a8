package uk.gegc.imagestudio.features.audit.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.imagestudio.features.audit.api.dto.AuditRecordDto;
import uk.gegc.imagestudio.features.audit.api.dto.UserActivitySummaryDto;
import uk.gegc.imagestudio.features.audit.application.AuditQueryService;
import uk.gegc.imagestudio.features.audit.domain.model.AuditCategory;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.infra.mapping.AuditRecordMapper;
import uk.gegc.imagestudio.features.audit.infra.repository.AuditRecordRepository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AuditQueryServiceImpl implements AuditQueryService {

    private final AuditRecordRepository auditRecordRepository;
    private final AuditRecordMapper auditRecordMapper;

    @Override
    @Transactional(readOnly = true)
    public Page<AuditRecordDto> search(String userId,
                                       AuditEventType eventType,
                                       AuditCategory category,
                                       AuditSeverity severity,
                                       Instant dateFrom,
                                       Instant dateTo,
                                       Pageable pageable) {
        return auditRecordRepository
                .findByFilters(userId, eventType, category, severity, dateFrom, dateTo, pageable)
                .map(auditRecordMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public UserActivitySummaryDto summarizeUser(String userId) {
        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (AuditCategory category : AuditCategory.values()) {
            byCategory.put(category.wireName(), 0L);
        }

        long total = 0;
        Instant lastActivity = null;
        for (var row : auditRecordRepository.summarizeByCategory(userId)) {
            long count = row.getTotal() != null ? row.getTotal() : 0L;
            byCategory.put(row.getCategory().wireName(), count);
            total += count;
            if (row.getLastAt() != null && (lastActivity == null || row.getLastAt().isAfter(lastActivity))) {
                lastActivity = row.getLastAt();
            }
        }

        long violations = auditRecordRepository.countByUserIdAndEventType(userId, AuditEventType.POLICY_VIOLATION);
        long rateLimitHits = auditRecordRepository.countByUserIdAndEventType(userId, AuditEventType.RATE_LIMIT_EXCEEDED);

        return new UserActivitySummaryDto(userId, total, byCategory, violations, rateLimitHits, lastActivity);
    }
}
