package uk.gegc.imagestudio.features.ratelimit.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateWindow;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RateWindowRepository extends JpaRepository<RateWindow, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM RateWindow w WHERE w.windowKey = :windowKey")
    Optional<RateWindow> findByKeyForUpdate(@Param("windowKey") String windowKey);

    @Query("SELECT w.windowKey FROM RateWindow w WHERE w.windowEnd < :cutoff ORDER BY w.windowEnd")
    List<String> findKeysEndedBefore(@Param("cutoff") Instant cutoff, Pageable pageable);
}
