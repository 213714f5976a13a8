package uk.gegc.imagestudio.features.admission.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.security.access.AccessDeniedException;
import uk.gegc.imagestudio.BaseUnitTest;
import uk.gegc.imagestudio.features.admission.api.dto.AdmissionDto;
import uk.gegc.imagestudio.features.admission.application.AdmissionProperties;
import uk.gegc.imagestudio.features.admission.application.AdmissionRequest;
import uk.gegc.imagestudio.features.admission.application.AdmissionResult;
import uk.gegc.imagestudio.features.admission.domain.model.Admission;
import uk.gegc.imagestudio.features.admission.domain.model.AdmissionDenialReason;
import uk.gegc.imagestudio.features.admission.domain.model.AdmissionStatus;
import uk.gegc.imagestudio.features.admission.infra.mapping.AdmissionMapper;
import uk.gegc.imagestudio.features.admission.infra.repository.AdmissionRepository;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.ledger.application.ChargeResult;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.application.RefundResult;
import uk.gegc.imagestudio.features.policy.application.ContentPolicyEngine;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyRule;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateDecision;
import uk.gegc.imagestudio.shared.exception.StoreUnavailableException;
import uk.gegc.imagestudio.shared.exception.UnknownOperationClassException;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;
import uk.gegc.imagestudio.shared.store.StoreTransactionExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("AdmissionOrchestratorImpl")
class AdmissionOrchestratorImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String USER = "user-1";

    @Mock
    private RateLimiterService rateLimiterService;

    @Mock
    private ContentPolicyEngine contentPolicyEngine;

    @Mock
    private CreditLedgerService creditLedgerService;

    @Mock
    private AdmissionRepository admissionRepository;

    @Mock
    private AdmissionMapper admissionMapper;

    @Mock
    private StoreTransactionExecutor storeExecutor;

    @Mock
    private AuditLogWriter auditLogWriter;

    private SimpleMeterRegistry meterRegistry;
    private AdmissionOrchestratorImpl orchestrator;

    @BeforeEach
    void setUp() {
        AdmissionProperties properties = new AdmissionProperties();
        AdmissionProperties.OperationCost edit = new AdmissionProperties.OperationCost();
        edit.setCost(5);
        properties.getOperations().put("edit", edit);

        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new AdmissionOrchestratorImpl(rateLimiterService, contentPolicyEngine, creditLedgerService,
                admissionRepository, admissionMapper, properties, storeExecutor, auditLogWriter, meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC));

        lenient().when(storeExecutor.execute(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> work = invocation.getArgument(1);
            return work.get();
        });
        lenient().when(admissionRepository.saveAndFlush(any(Admission.class))).thenAnswer(i -> i.getArgument(0));
        lenient().when(admissionRepository.save(any(Admission.class))).thenAnswer(i -> i.getArgument(0));
        lenient().when(admissionMapper.toDto(any(Admission.class))).thenAnswer(i -> {
            Admission a = i.getArgument(0);
            return new AdmissionDto(a.getId(), a.getUserId(), a.getOperationClass(), a.getCost(), a.isPrivileged(),
                    a.getRiskLevel(), a.getStatus(), a.getFailureReason(), a.getCreatedAt(), a.getCompletedAt());
        });
    }

    private static AdmissionRequest request(Long requestedCost) {
        return new AdmissionRequest("edit", requestedCost, "make the sky purple", 0, false);
    }

    private static RateDecision allowedRate() {
        return RateDecision.allowed(1, 10, NOW.plusSeconds(60));
    }

    private static PolicyDecision allowedPolicy() {
        return PolicyDecision.allow(RiskLevel.LOW, 0, PolicyRule.NO_RESTRICTION);
    }

    private AuditEntry singleAuditRecord() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogWriter).record(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("admit")
    class Admit {

        @Test
        @DisplayName("rate limit denial stops before policy and billing")
        void rateLimited() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW)))
                    .thenReturn(RateDecision.denied(10, 10, NOW.plusSeconds(30)));

            AdmissionResult result = orchestrator.admit(AuthenticatedIdentity.user(USER), request(null));

            assertThat(result.allowed()).isFalse();
            assertThat(result.reason()).isEqualTo(AdmissionDenialReason.RATE_LIMITED);
            verifyNoInteractions(contentPolicyEngine, creditLedgerService, admissionRepository);
            assertThat(singleAuditRecord().getEventType()).isEqualTo(AuditEventType.RATE_LIMIT_EXCEEDED);
        }

        @Test
        @DisplayName("policy denial stops before billing")
        void policyViolation() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW))).thenReturn(allowedRate());
            when(contentPolicyEngine.evaluate(anyString(), anyInt(), anyBoolean())).thenReturn(
                    PolicyDecision.deny(RiskLevel.HIGH, 0, PolicyRule.FORBIDDEN_TERM, "nude", "forbidden"));

            AdmissionResult result = orchestrator.admit(AuthenticatedIdentity.user(USER), request(null));

            assertThat(result.reason()).isEqualTo(AdmissionDenialReason.POLICY_VIOLATION);
            assertThat(result.riskLevel()).isEqualTo(RiskLevel.HIGH);
            verifyNoInteractions(creditLedgerService, admissionRepository);
            AuditEntry audit = singleAuditRecord();
            assertThat(audit.getEventType()).isEqualTo(AuditEventType.POLICY_VIOLATION);
            assertThat(audit.getDetails()).containsKeys("rateLimit", "policy").doesNotContainKey("charge");
        }

        @Test
        @DisplayName("insufficient credits store no admission")
        void insufficientCredits() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW))).thenReturn(allowedRate());
            when(contentPolicyEngine.evaluate(anyString(), anyInt(), anyBoolean())).thenReturn(allowedPolicy());
            when(creditLedgerService.charge(any(), eq(5L), anyString(), anyMap()))
                    .thenReturn(ChargeResult.insufficient(2, 5));

            AdmissionResult result = orchestrator.admit(AuthenticatedIdentity.user(USER), request(null));

            assertThat(result.reason()).isEqualTo(AdmissionDenialReason.INSUFFICIENT_CREDITS);
            assertThat(result.balanceAfter()).isEqualTo(2L);
            assertThat(result.cost()).isEqualTo(5);
            verifyNoInteractions(admissionRepository);
            assertThat(singleAuditRecord().getEventType()).isEqualTo(AuditEventType.INSUFFICIENT_CREDITS);
        }

        @Test
        @DisplayName("granted admission is charged, stored and audited once")
        void admitted() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW))).thenReturn(allowedRate());
            when(contentPolicyEngine.evaluate(anyString(), anyInt(), anyBoolean())).thenReturn(allowedPolicy());
            when(creditLedgerService.charge(any(), eq(5L), anyString(), anyMap()))
                    .thenReturn(ChargeResult.charged(15, UUID.randomUUID(), 5));

            AdmissionResult result = orchestrator.admit(AuthenticatedIdentity.user(USER), request(null));

            assertThat(result.allowed()).isTrue();
            assertThat(result.admissionId()).isNotNull();
            assertThat(result.balanceAfter()).isEqualTo(15L);

            ArgumentCaptor<Admission> saved = ArgumentCaptor.forClass(Admission.class);
            verify(admissionRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getStatus()).isEqualTo(AdmissionStatus.ADMITTED);
            assertThat(saved.getValue().getChargeReference())
                    .isEqualTo(AdmissionOrchestratorImpl.CHARGE_REFERENCE_PREFIX + result.admissionId());
            assertThat(singleAuditRecord().getEventType()).isEqualTo(AuditEventType.ADMISSION_GRANTED);
            assertThat(meterRegistry.counter("admission.decisions", "outcome", "admitted").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a caller-supplied cost may raise but never lower the configured cost")
        void requestedCost() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW))).thenReturn(allowedRate());
            when(contentPolicyEngine.evaluate(anyString(), anyInt(), anyBoolean())).thenReturn(allowedPolicy());
            when(creditLedgerService.charge(any(), anyLong(), anyString(), anyMap()))
                    .thenReturn(ChargeResult.charged(10, UUID.randomUUID(), 5));

            orchestrator.admit(AuthenticatedIdentity.user(USER), request(1L));
            orchestrator.admit(AuthenticatedIdentity.user(USER), request(8L));

            verify(creditLedgerService).charge(any(), eq(5L), anyString(), anyMap());
            verify(creditLedgerService).charge(any(), eq(8L), anyString(), anyMap());
        }

        @Test
        @DisplayName("privileged callers are admitted at zero cost")
        void privileged() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW))).thenReturn(RateDecision.bypass(10));
            when(contentPolicyEngine.evaluate(anyString(), anyInt(), anyBoolean())).thenReturn(allowedPolicy());
            when(creditLedgerService.charge(any(), eq(5L), anyString(), anyMap())).thenReturn(ChargeResult.waived(5));

            AdmissionResult result = orchestrator.admit(AuthenticatedIdentity.admin("admin-1"), request(null));

            assertThat(result.allowed()).isTrue();
            assertThat(result.privileged()).isTrue();
            assertThat(result.cost()).isZero();
            ArgumentCaptor<Admission> saved = ArgumentCaptor.forClass(Admission.class);
            verify(admissionRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getCost()).isZero();
            assertThat(saved.getValue().getChargeReference()).isNull();
        }

        @Test
        @DisplayName("unknown operation classes are rejected before any check")
        void unknownClass() {
            assertThatThrownBy(() -> orchestrator.admit(AuthenticatedIdentity.user(USER),
                    new AdmissionRequest("teleport", null, "x", 0, false)))
                    .isInstanceOf(UnknownOperationClassException.class);
            verifyNoInteractions(rateLimiterService, auditLogWriter);
        }

        @Test
        @DisplayName("a store failure denies the attempt and is audited")
        void storeFailure() {
            when(rateLimiterService.allow(any(), eq("edit"), eq(NOW))).thenThrow(
                    new StoreUnavailableException("ratelimit.allow", new DataAccessResourceFailureException("down")));

            assertThatThrownBy(() -> orchestrator.admit(AuthenticatedIdentity.user(USER), request(null)))
                    .isInstanceOf(StoreUnavailableException.class);

            AuditEntry audit = singleAuditRecord();
            assertThat(audit.getEventType()).isEqualTo(AuditEventType.ADMISSION_FAILED);
            assertThat(audit.getDetails()).containsEntry("failedOperation", "ratelimit.allow");
            verifyNoInteractions(creditLedgerService);
        }
    }

    @Nested
    @DisplayName("reportOutcome")
    class ReportOutcome {

        private Admission admitted(long cost) {
            Admission admission = new Admission();
            admission.setId(UUID.randomUUID());
            admission.setUserId(USER);
            admission.setOperationClass("edit");
            admission.setCost(cost);
            admission.setRiskLevel(RiskLevel.LOW);
            admission.setStatus(AdmissionStatus.ADMITTED);
            admission.setCreatedAt(NOW.minus(Duration.ofMinutes(1)));
            admission.setUpdatedAt(NOW.minus(Duration.ofMinutes(1)));
            return admission;
        }

        @Test
        @DisplayName("success settles the admission without a refund")
        void succeeded() {
            Admission admission = admitted(5);
            when(admissionRepository.findByIdForUpdate(admission.getId())).thenReturn(Optional.of(admission));

            AdmissionDto dto = orchestrator.reportOutcome(admission.getId(), AuthenticatedIdentity.user(USER), true, null);

            assertThat(dto.status()).isEqualTo(AdmissionStatus.SUCCEEDED);
            verify(creditLedgerService, never()).refund(anyString(), anyLong(), anyString(), any());
        }

        @Test
        @DisplayName("failure refunds the charged cost")
        void failedIsRefunded() {
            Admission admission = admitted(5);
            when(admissionRepository.findByIdForUpdate(admission.getId())).thenReturn(Optional.of(admission));
            when(creditLedgerService.refund(USER, 5, admission.getId().toString(), "model crashed"))
                    .thenReturn(new RefundResult(RefundResult.Outcome.REFUNDED, 20L, null));

            AdmissionDto dto = orchestrator.reportOutcome(admission.getId(), AuthenticatedIdentity.user(USER),
                    false, "model crashed");

            assertThat(dto.status()).isEqualTo(AdmissionStatus.REFUNDED);
            assertThat(dto.failureReason()).isEqualTo("model crashed");
        }

        @Test
        @DisplayName("an escalated refund leaves the admission awaiting manual reconciliation")
        void escalated() {
            Admission admission = admitted(5);
            when(admissionRepository.findByIdForUpdate(admission.getId())).thenReturn(Optional.of(admission));
            when(creditLedgerService.refund(eq(USER), eq(5L), anyString(), any()))
                    .thenReturn(new RefundResult(RefundResult.Outcome.ESCALATED, null, UUID.randomUUID()));

            AdmissionDto dto = orchestrator.reportOutcome(admission.getId(), AuthenticatedIdentity.user(USER), false, null);

            assertThat(dto.status()).isEqualTo(AdmissionStatus.REFUND_ESCALATED);
        }

        @Test
        @DisplayName("a second report changes nothing")
        void repeated() {
            Admission admission = admitted(5);
            when(admissionRepository.findByIdForUpdate(admission.getId())).thenReturn(Optional.of(admission));
            when(creditLedgerService.refund(eq(USER), eq(5L), anyString(), any()))
                    .thenReturn(new RefundResult(RefundResult.Outcome.REFUNDED, 20L, null));

            orchestrator.reportOutcome(admission.getId(), AuthenticatedIdentity.user(USER), false, "boom");
            AdmissionDto second = orchestrator.reportOutcome(admission.getId(), AuthenticatedIdentity.user(USER), false, "boom");

            assertThat(second.status()).isEqualTo(AdmissionStatus.REFUNDED);
            verify(creditLedgerService, times(1)).refund(eq(USER), eq(5L), anyString(), any());
        }

        @Test
        @DisplayName("zero-cost failures are not refunded")
        void zeroCost() {
            Admission admission = admitted(0);
            when(admissionRepository.findByIdForUpdate(admission.getId())).thenReturn(Optional.of(admission));

            AdmissionDto dto = orchestrator.reportOutcome(admission.getId(), AuthenticatedIdentity.admin("admin-1"),
                    false, "boom");

            assertThat(dto.status()).isEqualTo(AdmissionStatus.FAILED);
            verify(creditLedgerService, never()).refund(anyString(), anyLong(), anyString(), any());
        }

        @Test
        @DisplayName("other users may not report an outcome")
        void notOwner() {
            Admission admission = admitted(5);
            when(admissionRepository.findByIdForUpdate(admission.getId())).thenReturn(Optional.of(admission));

            assertThatThrownBy(() -> orchestrator.reportOutcome(admission.getId(),
                    AuthenticatedIdentity.user("intruder"), true, null))
                    .isInstanceOf(AccessDeniedException.class);
        }
    }

    @Nested
    @DisplayName("expireStaleAdmissions")
    class Expire {

        @Test
        @DisplayName("stale admitted rows are failed and refunded")
        void expires() {
            Admission stale = new Admission();
            stale.setId(UUID.randomUUID());
            stale.setUserId(USER);
            stale.setOperationClass("edit");
            stale.setCost(5);
            stale.setRiskLevel(RiskLevel.LOW);
            stale.setStatus(AdmissionStatus.ADMITTED);

            when(admissionRepository.findStaleIds(eq(AdmissionStatus.ADMITTED), any(), any()))
                    .thenReturn(List.of(stale.getId()));
            when(admissionRepository.findStaleIds(eq(AdmissionStatus.FAILED), any(), any()))
                    .thenReturn(List.of());
            when(admissionRepository.findByIdForUpdate(stale.getId())).thenReturn(Optional.of(stale));
            when(creditLedgerService.refund(eq(USER), eq(5L), eq(stale.getId().toString()),
                    eq(AdmissionOrchestratorImpl.TIMEOUT_REASON)))
                    .thenReturn(new RefundResult(RefundResult.Outcome.REFUNDED, 5L, null));

            int compensated = orchestrator.expireStaleAdmissions(NOW);

            assertThat(compensated).isEqualTo(1);
            assertThat(stale.getStatus()).isEqualTo(AdmissionStatus.REFUNDED);
        }
    }
}
