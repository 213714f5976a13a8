package uk.gegc.imagestudio.features.ledger.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;
import uk.gegc.imagestudio.features.ledger.api.dto.AdjustmentResultDto;
import uk.gegc.imagestudio.features.ledger.api.dto.BalanceDto;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.application.AllocationResult;
import uk.gegc.imagestudio.features.ledger.application.ChargeResult;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.application.LedgerMetricsService;
import uk.gegc.imagestudio.features.ledger.application.LedgerStructuredLogger;
import uk.gegc.imagestudio.features.ledger.application.ManualReconciliationService;
import uk.gegc.imagestudio.features.ledger.application.RefundResult;
import uk.gegc.imagestudio.features.ledger.domain.exception.InsufficientCreditsException;
import uk.gegc.imagestudio.features.ledger.domain.exception.LedgerReferenceConflictException;
import uk.gegc.imagestudio.features.ledger.domain.model.*;
import uk.gegc.imagestudio.features.ledger.infra.mapping.LedgerAccountMapper;
import uk.gegc.imagestudio.features.ledger.infra.mapping.LedgerEntryMapper;
import uk.gegc.imagestudio.features.ledger.infra.repository.LedgerAccountRepository;
import uk.gegc.imagestudio.features.ledger.infra.repository.LedgerEntryRepository;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;
import uk.gegc.imagestudio.shared.store.StoreTransactionExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerServiceImpl.class);

    public static final String REFUND_REFERENCE_PREFIX = "refund:";
    public static final String ADMIN_REFERENCE_PREFIX = "admin:";

    private final LedgerAccountRepository accountRepository;
    private final LedgerEntryRepository entryRepository;
    private final LedgerAccountMapper accountMapper;
    private final LedgerEntryMapper entryMapper;
    private final ManualReconciliationService manualReconciliationService;
    private final StoreTransactionExecutor storeExecutor;
    private final AuditLogWriter auditLogWriter;
    private final LedgerMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ChargeResult charge(AuthenticatedIdentity identity, long amount, String reference, Map<String, Object> metadata) {
        requirePositive(amount, "amount");
        requireReference(reference);

        if (identity.privileged()) {
            metricsService.incrementChargeWaived();
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.CHARGE_WAIVED)
                    .userId(identity.userId())
                    .action("charge:" + reference)
                    .detail("reference", reference)
                    .detail("cost", amount)
                    .build());
            return ChargeResult.waived(amount);
        }

        ChargeResult result = debit(identity.userId(), amount, reference, LedgerEntrySource.ADMISSION, metadata);
        if (result.charged()) {
            metricsService.incrementCharged(amount);
        } else {
            metricsService.incrementChargeRefused();
        }
        return result;
    }

    @Override
    public AllocationResult allocate(String userId, long amount, String reference, LedgerEntrySource source,
                                     Map<String, Object> metadata) {
        requireReference(reference);

        AllocationResult result = storeExecutor.execute("ledger.allocate",
                () -> allocateInTransaction(userId, amount, reference, source, metadata));

        afterAllocation(result, reference, source);
        return result;
    }

    @Override
    public LedgerEntryDto recordPending(String userId, long credits, String reference, LedgerEntrySource source,
                                        Map<String, Object> metadata) {
        requireUser(userId);
        requirePositive(credits, "credits");
        requireReference(reference);

        LedgerEntry entry = storeExecutor.execute("ledger.record-pending", () -> {
            Optional<LedgerEntry> existing = entryRepository.findByExternalReference(reference);
            if (existing.isPresent()) {
                LedgerEntry found = existing.get();
                if (found.getKind() != LedgerEntryKind.ALLOCATION) {
                    throw new LedgerReferenceConflictException(reference, "Reference already used by a " + found.getKind());
                }
                return found;
            }
            Instant now = clock.instant();
            LedgerEntry pending = newEntry(userId, LedgerEntryKind.ALLOCATION, source, credits, reference,
                    LedgerEntryStatus.PENDING, metadata, now);
            return entryRepository.saveAndFlush(pending);
        });

        LedgerStructuredLogger.logLedgerWrite(log, "info",
                "Pending allocation recorded: userId={}, credits={}, reference={}",
                userId, LedgerEntryKind.ALLOCATION.name(), source.name(), credits, reference, null,
                userId, credits, reference);
        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.PAYMENT_PENDING)
                .userId(userId)
                .action("pending:" + reference)
                .detail("reference", reference)
                .detail("credits", credits)
                .detail("source", source.name())
                .build());
        return entryMapper.toDto(entry);
    }

    @Override
    public boolean markFailed(String reference, String reason) {
        requireReference(reference);

        Optional<LedgerEntry> failed = storeExecutor.execute("ledger.mark-failed", () -> {
            Optional<LedgerEntry> existing = entryRepository.findByExternalReferenceForUpdate(reference);
            if (existing.isEmpty()) {
                log.warn("markFailed: no entry for reference {}", reference);
                return Optional.<LedgerEntry>empty();
            }
            LedgerEntry entry = existing.get();
            if (!entry.isPending()) {
                log.info("markFailed: entry {} is already {}, leaving it untouched", reference, entry.getStatus());
                return Optional.<LedgerEntry>empty();
            }
            entry.fail(reason, clock.instant());
            return Optional.of(entryRepository.save(entry));
        });

        failed.ifPresent(entry -> auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.PAYMENT_FAILED)
                .userId(entry.getUserId())
                .action("failed:" + reference)
                .severity(AuditSeverity.WARNING)
                .status(AuditStatus.FAILURE)
                .detail("reference", reference)
                .detail("credits", entry.getAmount())
                .detail("reason", reason)
                .build()));
        return failed.isPresent();
    }

    @Override
    public RefundResult refund(String userId, long amount, String admissionId, String reason) {
        requireUser(userId);
        requirePositive(amount, "amount");
        String reference = REFUND_REFERENCE_PREFIX + admissionId;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("admissionId", admissionId);
        metadata.put("reason", reason);

        AllocationResult allocation;
        try {
            allocation = storeExecutor.executeOnce("ledger.refund",
                    () -> allocateInTransaction(userId, amount, reference, LedgerEntrySource.REFUND, metadata));
        } catch (RuntimeException ex) {
            return escalateRefund(userId, amount, reference, reason, "refund failed: " + ex.getMessage());
        }

        RefundResult result = switch (allocation.outcome()) {
            case APPLIED -> {
                LedgerStructuredLogger.logLedgerWrite(log, "info",
                        "Refunded {} credits to {} for admission {}",
                        userId, LedgerEntryKind.ALLOCATION.name(), LedgerEntrySource.REFUND.name(), amount,
                        reference, allocation.balanceAfter(),
                        amount, userId, admissionId);
                auditLogWriter.record(AuditEntry.builder()
                        .eventType(AuditEventType.CREDITS_REFUNDED)
                        .userId(userId)
                        .action(reference)
                        .detail("admissionId", admissionId)
                        .detail("credits", amount)
                        .detail("balanceAfter", allocation.balanceAfter())
                        .detail("reason", reason)
                        .build());
                yield new RefundResult(RefundResult.Outcome.REFUNDED, allocation.balanceAfter(), null);
            }
            case DUPLICATE -> {
                log.info("Refund {} was already applied", reference);
                yield new RefundResult(RefundResult.Outcome.ALREADY_REFUNDED, allocation.balanceAfter(), null);
            }
            case CONFLICT -> null;
        };
        if (result == null) {
            return escalateRefund(userId, amount, reference, reason, "refund reference is in FAILED state");
        }
        metricsService.incrementRefund(result.outcome());
        return result;
    }

    @Override
    public AdjustmentResultDto adjust(String adminUserId, String userId, long signedAmount, String reason,
                                      String idempotencyKey) {
        requireUser(userId);
        if (signedAmount == 0) {
            throw new IllegalArgumentException("amount must not be zero");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("idempotencyKey is required");
        }
        String reference = ADMIN_REFERENCE_PREFIX + idempotencyKey.trim();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("admin", adminUserId);
        metadata.put("reason", reason);

        AdjustmentResultDto result;
        if (signedAmount > 0) {
            AllocationResult allocation = storeExecutor.execute("ledger.adjust",
                    () -> allocateInTransaction(userId, signedAmount, reference, LedgerEntrySource.ADMIN, metadata));
            if (allocation.outcome() == AllocationResult.Outcome.CONFLICT) {
                throw new LedgerReferenceConflictException(reference, "Idempotency key belongs to a failed entry");
            }
            if (!allocation.userId().equals(userId) || allocation.amount() != signedAmount) {
                throw new LedgerReferenceConflictException(reference, "Idempotency key already used for a different adjustment");
            }
            result = new AdjustmentResultDto(userId, signedAmount, allocation.entryId(), allocation.balanceAfter(),
                    allocation.outcome() == AllocationResult.Outcome.DUPLICATE);
        } else {
            long debitAmount = -signedAmount;
            Optional<LedgerEntry> prior = storeExecutor.execute("ledger.adjust.lookup",
                    () -> entryRepository.findByExternalReference(reference));
            ChargeResult charge = debit(userId, debitAmount, reference, LedgerEntrySource.ADMIN, metadata);
            if (!charge.charged()) {
                throw new InsufficientCreditsException(
                        "Adjustment of " + signedAmount + " would overdraw the account",
                        debitAmount, charge.balanceAfter() == null ? 0 : charge.balanceAfter());
            }
            result = new AdjustmentResultDto(userId, signedAmount, charge.entryId(), charge.balanceAfter(),
                    prior.isPresent());
        }

        if (!result.duplicate()) {
            log.info("Admin {} adjusted credits of {} by {}: {}", adminUserId, userId, signedAmount, reason);
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.ADMIN_CREDITS_ADJUSTED)
                    .userId(userId)
                    .action(reference)
                    .detail("adminId", adminUserId)
                    .detail("amount", signedAmount)
                    .detail("balanceAfter", result.balanceAfter())
                    .detail("reason", reason)
                    .build());
        }
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public BalanceDto getBalance(String userId) {
        return accountRepository.findById(userId)
                .map(accountMapper::toDto)
                .orElseGet(() -> new BalanceDto(userId, 0L, null));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<LedgerEntryDto> listEntries(String userId, LedgerEntryKind kind, LedgerEntrySource source,
                                            LedgerEntryStatus status, Instant dateFrom, Instant dateTo,
                                            Pageable pageable) {
        return entryRepository
                .findByFilters(userId, kind, source, status, dateFrom, dateTo, pageable)
                .map(entryMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LedgerEntryDto> findByReference(String reference) {
        return entryRepository.findByExternalReference(reference).map(entryMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntryDto> findPendingCreatedBefore(Instant cutoff, LedgerEntryDto after, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        if (after == null) {
            return entryMapper.toDtos(entryRepository.findByStatusCreatedBefore(
                    LedgerEntryStatus.PENDING, cutoff, page));
        }
        return entryMapper.toDtos(entryRepository.findByStatusCreatedBeforeAfter(
                LedgerEntryStatus.PENDING, cutoff, after.createdAt(), after.externalReference(), page));
    }

    private ChargeResult debit(String userId, long amount, String reference, LedgerEntrySource source,
                               Map<String, Object> metadata) {
        ChargeResult result = storeExecutor.execute("ledger.charge", () -> {
            Optional<LedgerEntry> existing = entryRepository.findByExternalReference(reference);
            if (existing.isPresent()) {
                LedgerEntry entry = existing.get();
                if (entry.getKind() != LedgerEntryKind.CHARGE || !entry.getUserId().equals(userId)) {
                    throw new LedgerReferenceConflictException(reference, "Reference already used by another entry");
                }
                return ChargeResult.charged(entry.getBalanceAfter(), entry.getId(), -entry.getAmount());
            }

            Instant now = clock.instant();
            LedgerAccount account = lockOrOpenAccount(userId, now);
            if (account.getBalance() < amount) {
                return ChargeResult.insufficient(account.getBalance(), amount);
            }

            long balanceAfter = account.apply(-amount, now);
            accountRepository.save(account);

            LedgerEntry entry = newEntry(userId, LedgerEntryKind.CHARGE, source, -amount, reference,
                    LedgerEntryStatus.COMPLETED, metadata, now);
            entry.setBalanceAfter(balanceAfter);
            entry.setCompletedAt(now);
            entry = entryRepository.saveAndFlush(entry);
            return ChargeResult.charged(balanceAfter, entry.getId(), amount);
        });

        if (result.charged()) {
            LedgerStructuredLogger.logLedgerWrite(log, "info",
                    "Charged {} credits from {} (reference {}), balance now {}",
                    userId, LedgerEntryKind.CHARGE.name(), source.name(), -amount, reference, result.balanceAfter(),
                    amount, userId, reference, result.balanceAfter());
        } else {
            log.info("Charge of {} refused for {}: balance {}", amount, userId, result.balanceAfter());
        }
        return result;
    }

    /**
     * Runs inside the caller's transaction; the retry wrapper re-reads the entry on every attempt.
     */
    private AllocationResult allocateInTransaction(String userId, long amount, String reference,
                                                   LedgerEntrySource source, Map<String, Object> metadata) {
        Instant now = clock.instant();
        Optional<LedgerEntry> existing = entryRepository.findByExternalReferenceForUpdate(reference);

        if (existing.isPresent()) {
            LedgerEntry entry = existing.get();
            if (entry.getKind() != LedgerEntryKind.ALLOCATION) {
                throw new LedgerReferenceConflictException(reference, "Reference already used by a " + entry.getKind());
            }
            switch (entry.getStatus()) {
                case COMPLETED:
                    return new AllocationResult(AllocationResult.Outcome.DUPLICATE, entry.getUserId(),
                            entry.getAmount(), entry.getId(), entry.getBalanceAfter());
                case FAILED:
                    return new AllocationResult(AllocationResult.Outcome.CONFLICT, entry.getUserId(),
                            entry.getAmount(), entry.getId(), null);
                default:
                    if (userId != null && !userId.equals(entry.getUserId())) {
                        log.warn("Allocation for {} names user {} but the pending entry belongs to {}",
                                reference, userId, entry.getUserId());
                    }
                    if (amount > 0 && amount != entry.getAmount()) {
                        log.warn("Allocation for {} carries {} credits; the pending amount {} is used",
                                reference, amount, entry.getAmount());
                    }
                    LedgerAccount account = lockOrOpenAccount(entry.getUserId(), now);
                    long balanceAfter = account.apply(entry.getAmount(), now);
                    accountRepository.save(account);
                    entry.complete(balanceAfter, now);
                    entryRepository.saveAndFlush(entry);
                    return new AllocationResult(AllocationResult.Outcome.APPLIED, entry.getUserId(),
                            entry.getAmount(), entry.getId(), balanceAfter);
            }
        }

        requireUser(userId);
        requirePositive(amount, "amount");
        LedgerAccount account = lockOrOpenAccount(userId, now);
        long balanceAfter = account.apply(amount, now);
        accountRepository.save(account);

        LedgerEntry entry = newEntry(userId, LedgerEntryKind.ALLOCATION, source, amount, reference,
                LedgerEntryStatus.COMPLETED, metadata, now);
        entry.setBalanceAfter(balanceAfter);
        entry.setCompletedAt(now);
        entry = entryRepository.saveAndFlush(entry);
        return new AllocationResult(AllocationResult.Outcome.APPLIED, userId, amount, entry.getId(), balanceAfter);
    }

    private void afterAllocation(AllocationResult result, String reference, LedgerEntrySource source) {
        switch (result.outcome()) {
            case APPLIED -> {
                metricsService.incrementAllocated(source.name(), result.amount());
                LedgerStructuredLogger.logLedgerWrite(log, "info",
                        "Allocated {} credits to {} (reference {}), balance now {}",
                        result.userId(), LedgerEntryKind.ALLOCATION.name(), source.name(), result.amount(),
                        reference, result.balanceAfter(),
                        result.amount(), result.userId(), reference, result.balanceAfter());
                auditLogWriter.record(AuditEntry.builder()
                        .eventType(AuditEventType.CREDITS_ALLOCATED)
                        .userId(result.userId())
                        .action("allocate:" + reference)
                        .detail("reference", reference)
                        .detail("credits", result.amount())
                        .detail("source", source.name())
                        .detail("balanceAfter", result.balanceAfter())
                        .build());
            }
            case DUPLICATE -> {
                metricsService.incrementAllocationDuplicate(source.name());
                log.info("Allocation {} already applied; duplicate absorbed", reference);
            }
            case CONFLICT -> {
                metricsService.incrementAllocationConflict(source.name());
                String reason = "allocation received for a FAILED entry";
                UUID recordId = openManualRecordSafely(result.userId(), result.amount(), reference, reason);
                auditLogWriter.record(AuditEntry.builder()
                        .eventType(AuditEventType.ALLOCATION_CONFLICT)
                        .userId(result.userId())
                        .action("allocate:" + reference)
                        .severity(AuditSeverity.CRITICAL)
                        .status(AuditStatus.FAILURE)
                        .detail("reference", reference)
                        .detail("credits", result.amount())
                        .detail("manualReconciliationId", recordId)
                        .build());
            }
        }
    }

    private RefundResult escalateRefund(String userId, long amount, String reference, String reason, String failure) {
        UUID recordId = openManualRecordSafely(userId, amount, reference, reason + " (" + failure + ")");
        metricsService.incrementRefund(RefundResult.Outcome.ESCALATED);
        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.REFUND_ESCALATED)
                .userId(userId)
                .action(reference)
                .severity(AuditSeverity.CRITICAL)
                .status(AuditStatus.FAILURE)
                .detail("reference", reference)
                .detail("credits", amount)
                .detail("reason", reason)
                .detail("failure", failure)
                .detail("manualReconciliationId", recordId)
                .build());
        return new RefundResult(RefundResult.Outcome.ESCALATED, null, recordId);
    }

    private UUID openManualRecordSafely(String userId, long amount, String reference, String reason) {
        LedgerStructuredLogger.logManualReconciliation(log,
                "Manual reconciliation required for {} ({} credits to {}): {}",
                userId, amount, reference, reason,
                reference, amount, userId, reason);
        try {
            UUID id = manualReconciliationService.open(userId, amount, reference, reason);
            metricsService.incrementManualReconciliationOpened(reason);
            return id;
        } catch (RuntimeException ex) {
            log.error("Could not store manual reconciliation record for {}; the log entry above is the only trace",
                    reference, ex);
            return null;
        }
    }

    private LedgerAccount lockOrOpenAccount(String userId, Instant now) {
        return accountRepository.findByUserIdForUpdate(userId).orElseGet(() -> {
            // A concurrent first insert fails on the primary key and the whole attempt is retried
            return accountRepository.saveAndFlush(LedgerAccount.open(userId, now));
        });
    }

    private LedgerEntry newEntry(String userId, LedgerEntryKind kind, LedgerEntrySource source, long amount,
                                 String reference, LedgerEntryStatus status, Map<String, Object> metadata,
                                 Instant now) {
        LedgerEntry entry = new LedgerEntry();
        entry.setUserId(userId);
        entry.setKind(kind);
        entry.setSource(source);
        entry.setAmount(amount);
        entry.setExternalReference(reference);
        entry.setStatus(status);
        entry.setMetaJson(toJson(metadata));
        entry.setCreatedAt(now);
        return entry;
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize ledger metadata: {}", e.getMessage());
            return null;
        }
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    private static void requireReference(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference is required");
        }
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }
}
