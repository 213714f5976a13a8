package uk.gegc.imagestudio.features.ledger.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntry;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryKind;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    Optional<LedgerEntry> findByExternalReference(String externalReference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM LedgerEntry e WHERE e.externalReference = :reference")
    Optional<LedgerEntry> findByExternalReferenceForUpdate(@Param("reference") String reference);

    @Query("""
        select e from LedgerEntry e
        where e.userId = :userId
          and (:kind is null or e.kind = :kind)
          and (:source is null or e.source = :source)
          and (:status is null or e.status = :status)
          and (:dateFrom is null or e.createdAt >= :dateFrom)
          and (:dateTo is null or e.createdAt <= :dateTo)
        order by e.createdAt desc
    """)
    Page<LedgerEntry> findByFilters(
            @Param("userId") String userId,
            @Param("kind") LedgerEntryKind kind,
            @Param("source") LedgerEntrySource source,
            @Param("status") LedgerEntryStatus status,
            @Param("dateFrom") Instant dateFrom,
            @Param("dateTo") Instant dateTo,
            Pageable pageable
    );

    @Query("""
        select coalesce(sum(e.amount), 0) from LedgerEntry e
        where e.userId = :userId and e.status = uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus.COMPLETED
    """)
    long sumCompletedAmount(@Param("userId") String userId);

    @Query("""
        select e from LedgerEntry e
        where e.status = :status and e.createdAt < :cutoff
        order by e.createdAt asc, e.externalReference asc
    """)
    List<LedgerEntry> findByStatusCreatedBefore(
            @Param("status") LedgerEntryStatus status,
            @Param("cutoff") Instant cutoff,
            Pageable pageable
    );

    /**
     * Next page after the {@code (createdAt, externalReference)} position of the last entry seen.
     */
    @Query("""
        select e from LedgerEntry e
        where e.status = :status and e.createdAt < :cutoff
          and (e.createdAt > :afterCreatedAt
               or (e.createdAt = :afterCreatedAt and e.externalReference > :afterReference))
        order by e.createdAt asc, e.externalReference asc
    """)
    List<LedgerEntry> findByStatusCreatedBeforeAfter(
            @Param("status") LedgerEntryStatus status,
            @Param("cutoff") Instant cutoff,
            @Param("afterCreatedAt") Instant afterCreatedAt,
            @Param("afterReference") String afterReference,
            Pageable pageable
    );

    long countByUserIdAndStatus(String userId, LedgerEntryStatus status);
}
