package uk.gegc.imagestudio.features.audit.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import uk.gegc.imagestudio.BaseUnitTest;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.PiiSanitizer;
import uk.gegc.imagestudio.features.audit.domain.model.AuditCategory;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditRecord;
import uk.gegc.imagestudio.features.audit.infra.repository.AuditRecordRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AuditLogWriterImpl")
class AuditLogWriterImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private AuditRecordRepository auditRecordRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private AuditLogWriterImpl writer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        writer = new AuditLogWriterImpl(auditRecordRepository, new PiiSanitizer(), new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC), transactionManager, meterRegistry);
    }

    @Test
    @DisplayName("persists a sanitized record with its category")
    void persistsRecord() {
        writer.record(AuditEntry.builder()
                .eventType(AuditEventType.POLICY_VIOLATION)
                .userId("user-1")
                .action("admit:edit")
                .detail("instruction", "swap face with bob@example.com")
                .build());

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(auditRecordRepository).save(captor.capture());
        AuditRecord record = captor.getValue();
        assertThat(record.getCategory()).isEqualTo(AuditCategory.POLICY);
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
        assertThat(record.getDetailsJson())
                .contains("[EMAIL_REDACTED]")
                .contains("instructionHash")
                .doesNotContain("bob@example.com");
    }

    @Test
    @DisplayName("a failed write is counted and never propagates")
    void failureSwallowedAndCounted() {
        when(auditRecordRepository.save(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatCode(() -> writer.record(AuditEntry.builder()
                .eventType(AuditEventType.ADMISSION_GRANTED)
                .userId("user-1")
                .action("admit:edit")
                .build()))
                .doesNotThrowAnyException();

        assertThat(meterRegistry.counter("audit.write_failures").count()).isEqualTo(1.0);
    }
}
