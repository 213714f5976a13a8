package uk.gegc.imagestudio.features.ledger.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.imagestudio.features.ledger.api.dto.AdjustmentResultDto;
import uk.gegc.imagestudio.features.ledger.api.dto.BalanceDto;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryKind;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-user credit balance with an append-only entry log. Every balance change happens under the
 * account's row lock together with exactly one entry, and every entry is unique by its external
 * reference, which makes each mutation idempotent.
 */
public interface CreditLedgerService {

    /**
     * Debits {@code amount} for an admitted operation. Re-invoking with the same reference returns
     * the original result. Insufficient funds change nothing and return {@code charged == false}.
     * Privileged callers are never charged.
     */
    ChargeResult charge(AuthenticatedIdentity identity, long amount, String reference, Map<String, Object> metadata);

    /**
     * Credits {@code amount} under {@code reference}. A pending entry with that reference is
     * completed once, using its own amount and user.
     */
    AllocationResult allocate(String userId, long amount, String reference, LedgerEntrySource source,
                              Map<String, Object> metadata);

    /**
     * Records an expected payment. The balance is not touched until {@link #allocate} completes it.
     */
    LedgerEntryDto recordPending(String userId, long credits, String reference, LedgerEntrySource source,
                                 Map<String, Object> metadata);

    /**
     * Moves a pending entry to FAILED.
     *
     * @return true if the entry transitioned; false when it was absent or already settled
     */
    boolean markFailed(String reference, String reason);

    /**
     * Compensates a charged admission whose operation failed. Single attempt; any failure is
     * escalated to the manual reconciliation queue instead of being retried.
     */
    RefundResult refund(String userId, long amount, String admissionId, String reason);

    /**
     * Administrative credit adjustment; negative amounts may not overdraw the account.
     */
    AdjustmentResultDto adjust(String adminUserId, String userId, long signedAmount, String reason, String idempotencyKey);

    BalanceDto getBalance(String userId);

    Page<LedgerEntryDto> listEntries(String userId, LedgerEntryKind kind, LedgerEntrySource source,
                                     LedgerEntryStatus status, Instant dateFrom, Instant dateTo, Pageable pageable);

    Optional<LedgerEntryDto> findByReference(String reference);

    /**
     * Oldest-first pending entries created before {@code cutoff}, ordered by creation time and then
     * reference. Pass the last entry of the previous page as {@code after} to continue, or
     * {@code null} for the first page.
     */
    List<LedgerEntryDto> findPendingCreatedBefore(Instant cutoff, LedgerEntryDto after, int limit);
}
