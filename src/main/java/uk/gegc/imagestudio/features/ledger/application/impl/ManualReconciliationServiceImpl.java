package uk.gegc.imagestudio.features.ledger.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.ledger.api.dto.ManualReconciliationDto;
import uk.gegc.imagestudio.features.ledger.application.ManualReconciliationService;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationRecord;
import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationStatus;
import uk.gegc.imagestudio.features.ledger.infra.mapping.ManualReconciliationMapper;
import uk.gegc.imagestudio.features.ledger.infra.repository.ManualReconciliationRepository;
import uk.gegc.imagestudio.shared.exception.ResourceNotFoundException;
import uk.gegc.imagestudio.shared.store.StoreTransactionExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ManualReconciliationServiceImpl implements ManualReconciliationService {

    private static final int MAX_REASON_LENGTH = 500;

    private final ManualReconciliationRepository repository;
    private final ManualReconciliationMapper mapper;
    private final StoreTransactionExecutor storeExecutor;
    private final AuditLogWriter auditLogWriter;
    private final Clock clock;

    @Override
    public UUID open(String userId, long amount, String reference, String reason) {
        return storeExecutor.execute("ledger.manual-reconciliation.open", () -> repository
                .findFirstByReferenceAndStatus(reference, ManualReconciliationStatus.OPEN)
                .map(ManualReconciliationRecord::getId)
                .orElseGet(() -> {
                    ManualReconciliationRecord record = new ManualReconciliationRecord();
                    record.setUserId(userId);
                    record.setAmount(amount);
                    record.setReference(reference);
                    record.setReason(truncate(reason));
                    record.setStatus(ManualReconciliationStatus.OPEN);
                    record.setCreatedAt(clock.instant());
                    return repository.saveAndFlush(record).getId();
                }));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ManualReconciliationDto> list(ManualReconciliationStatus status, String userId, Pageable pageable) {
        return repository.findByFilters(status, userId, pageable).map(mapper::toDto);
    }

    @Override
    public ManualReconciliationDto resolve(UUID id, String adminUserId, String note) {
        ManualReconciliationRecord resolved = storeExecutor.execute("ledger.manual-reconciliation.resolve", () -> {
            ManualReconciliationRecord record = repository.findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Manual reconciliation record " + id + " not found"));
            if (record.getStatus() == ManualReconciliationStatus.RESOLVED) {
                throw new IllegalStateException("Manual reconciliation record " + id + " is already resolved");
            }
            Instant now = clock.instant();
            record.setStatus(ManualReconciliationStatus.RESOLVED);
            record.setResolvedBy(adminUserId);
            record.setResolutionNote(note);
            record.setResolvedAt(now);
            return repository.save(record);
        });

        log.info("Admin {} resolved manual reconciliation {} ({})", adminUserId, id, resolved.getReference());
        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.ADMIN_RECONCILIATION_RESOLVED)
                .userId(resolved.getUserId())
                .action("resolve:" + resolved.getReference())
                .detail("adminId", adminUserId)
                .detail("recordId", id)
                .detail("note", note)
                .build());
        return mapper.toDto(resolved);
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "unspecified";
        }
        return reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
    }
}
