package uk.gegc.imagestudio.features.audit.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.imagestudio.features.audit.domain.model.AuditCategory;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditRecord;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, UUID> {

    @Query("""
        select a from AuditRecord a
        where (:userId is null or a.userId = :userId)
          and (:eventType is null or a.eventType = :eventType)
          and (:category is null or a.category = :category)
          and (:severity is null or a.severity = :severity)
          and (:dateFrom is null or a.createdAt >= :dateFrom)
          and (:dateTo is null or a.createdAt <= :dateTo)
        order by a.createdAt desc
    """)
    Page<AuditRecord> findByFilters(
            @Param("userId") String userId,
            @Param("eventType") AuditEventType eventType,
            @Param("category") AuditCategory category,
            @Param("severity") AuditSeverity severity,
            @Param("dateFrom") Instant dateFrom,
            @Param("dateTo") Instant dateTo,
            Pageable pageable
    );

    @Query("""
        select a.category as category, count(a) as total, max(a.createdAt) as lastAt
        from AuditRecord a
        where a.userId = :userId
        group by a.category
    """)
    List<CategoryActivity> summarizeByCategory(@Param("userId") String userId);

    List<AuditRecord> findByUserIdAndEventTypeOrderByCreatedAtAsc(String userId, AuditEventType eventType);

    long countByUserIdAndEventType(String userId, AuditEventType eventType);

    interface CategoryActivity {
        AuditCategory getCategory();

        Long getTotal();

        Instant getLastAt();
    }
}
