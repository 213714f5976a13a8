package uk.gegc.imagestudio.features.ledger.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerAccount;

import java.util.Optional;

public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, String> {

    /**
     * Row-locks the account for the rest of the transaction. Every balance change goes through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM LedgerAccount a WHERE a.userId = :userId")
    Optional<LedgerAccount> findByUserIdForUpdate(@Param("userId") String userId);
}
