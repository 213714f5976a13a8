package uk.gegc.imagestudio.features.audit.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.application.PiiSanitizer;
import uk.gegc.imagestudio.features.audit.domain.model.AuditRecord;
import uk.gegc.imagestudio.features.audit.infra.repository.AuditRecordRepository;
import uk.gegc.imagestudio.shared.logging.CorrelationIdFilter;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
public class AuditLogWriterImpl implements AuditLogWriter {

    private final AuditRecordRepository auditRecordRepository;
    private final PiiSanitizer sanitizer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final Counter writeFailureCounter;

    public AuditLogWriterImpl(AuditRecordRepository auditRecordRepository,
                              PiiSanitizer sanitizer,
                              ObjectMapper objectMapper,
                              Clock clock,
                              PlatformTransactionManager transactionManager,
                              MeterRegistry meterRegistry) {
        this.auditRecordRepository = auditRecordRepository;
        this.sanitizer = sanitizer;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.writeFailureCounter = Counter.builder("audit.write_failures")
                .description("Audit records that could not be persisted")
                .register(meterRegistry);
    }

    @Override
    public void record(AuditEntry entry) {
        try {
            AuditRecord record = new AuditRecord();
            record.setEventType(entry.getEventType());
            record.setCategory(entry.getEventType().category());
            record.setUserId(entry.getUserId());
            record.setSeverity(entry.getSeverity());
            record.setStatus(entry.getStatus());
            record.setAction(entry.getAction());
            record.setDetailsJson(toJson(sanitizer.sanitizeDetails(entry.getDetails())));
            record.setCorrelationId(CorrelationIdFilter.currentCorrelationId());
            record.setCreatedAt(clock.instant());

            transactionTemplate.executeWithoutResult(status -> auditRecordRepository.save(record));
        } catch (RuntimeException ex) {
            writeFailureCounter.increment();
            log.error("Failed to write audit record eventType={} userId={} action={}: {}",
                    entry.getEventType(), entry.getUserId(), entry.getAction(), ex.getMessage(), ex);
        }
    }

    private String toJson(Map<String, Object> details) {
        if (details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit details: {}", e.getMessage());
            return null;
        }
    }
}
