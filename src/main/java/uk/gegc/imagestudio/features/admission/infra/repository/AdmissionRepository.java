package uk.gegc.imagestudio.features.admission.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.imagestudio.features.admission.domain.model.Admission;
import uk.gegc.imagestudio.features.admission.domain.model.AdmissionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AdmissionRepository extends JpaRepository<Admission, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Admission a WHERE a.id = :id")
    Optional<Admission> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Admissions stuck in {@code status} since before {@code cutoff} that still owe a compensation.
     */
    @Query("""
        select a.id from Admission a
        where a.status = :status and a.updatedAt < :cutoff and a.cost > 0
        order by a.updatedAt asc
    """)
    List<UUID> findStaleIds(@Param("status") AdmissionStatus status,
                            @Param("cutoff") Instant cutoff,
                            Pageable pageable);

    long countByUserIdAndStatus(String userId, AdmissionStatus status);
}
