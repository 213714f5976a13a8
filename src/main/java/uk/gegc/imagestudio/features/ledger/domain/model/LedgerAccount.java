package uk.gegc.imagestudio.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "ledger_accounts")
@Getter
@Setter
@NoArgsConstructor
public class LedgerAccount {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static LedgerAccount open(String userId, Instant now) {
        LedgerAccount account = new LedgerAccount();
        account.setUserId(userId);
        account.setBalance(0L);
        account.setUpdatedAt(now);
        return account;
    }

    /**
     * Applies a signed amount. Callers check funds first; a negative result is a programming error.
     */
    public long apply(long signedAmount, Instant now) {
        long next = balance + signedAmount;
        if (next < 0) {
            throw new IllegalStateException("Balance of " + userId + " would become negative: " + next);
        }
        this.balance = next;
        this.updatedAt = now;
        return next;
    }
}
