package uk.gegc.imagestudio.features.ledger.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationRecord;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationStatus;

import java.util.Optional;
import java.util.UUID;

public interface ManualReconciliationRepository extends JpaRepository<ManualReconciliationRecord, UUID> {

    @Query("""
        select r from ManualReconciliationRecord r
        where (:status is null or r.status = :status)
          and (:userId is null or r.userId = :userId)
        order by r.createdAt desc
    """)
    Page<ManualReconciliationRecord> findByFilters(
            @Param("status") ManualReconciliationStatus status,
            @Param("userId") String userId,
            Pageable pageable
    );

    Optional<ManualReconciliationRecord> findFirstByReferenceAndStatus(String reference, ManualReconciliationStatus status);

    long countByStatus(ManualReconciliationStatus status);
}
