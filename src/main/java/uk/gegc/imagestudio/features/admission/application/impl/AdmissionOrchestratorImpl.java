package uk.gegc.imagestudio.features.admission.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import uk.gegc.imagestudio.features.admission.api.dto.AdmissionDto;
import uk.gegc.imagestudio.features.admission.application.AdmissionOrchestrator;
import uk.gegc.imagestudio.features.admission.application.AdmissionProperties;
import uk.gegc.imagestudio.features.admission.application.AdmissionRequest;
import uk.gegc.imagestudio.features.admission.application.AdmissionResult;
import uk.gegc.imagestudio.features.admission.domain.model.Admission;
import uk.gegc.imagestudio.features.admission.domain.model.AdmissionStatus;
import uk.gegc.imagestudio.features.admission.infra.mapping.AdmissionMapper;
import uk.gegc.imagestudio.features.admission.infra.repository.AdmissionRepository;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;
import uk.gegc.imagestudio.features.ledger.application.ChargeResult;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.application.RefundResult;
import uk.gegc.imagestudio.features.policy.application.ContentPolicyEngine;
import uk.gegc.imagestudio.features.policy.domain.model.PolicyDecision;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateDecision;
import uk.gegc.imagestudio.shared.exception.ResourceNotFoundException;
import uk.gegc.imagestudio.shared.exception.StoreUnavailableException;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;
import uk.gegc.imagestudio.shared.store.StoreTransactionExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Not transactional: every step commits its own short transaction so no lock is held while the
 * caller runs the external operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionOrchestratorImpl implements AdmissionOrchestrator {

    public static final String CHARGE_REFERENCE_PREFIX = "charge:";
    static final String TIMEOUT_REASON = "outcome not reported in time";

    private final RateLimiterService rateLimiterService;
    private final ContentPolicyEngine contentPolicyEngine;
    private final CreditLedgerService creditLedgerService;
    private final AdmissionRepository admissionRepository;
    private final AdmissionMapper admissionMapper;
    private final AdmissionProperties admissionProperties;
    private final StoreTransactionExecutor storeExecutor;
    private final AuditLogWriter auditLogWriter;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public AdmissionResult admit(AuthenticatedIdentity identity, AdmissionRequest request) {
        String operationClass = request.operationClass();
        long cost = resolveCost(operationClass, request.requestedCost());
        Instant now = clock.instant();
        UUID admissionId = UUID.randomUUID();

        AttemptSummary summary = new AttemptSummary(identity, request, admissionId, cost);
        try {
            RateDecision rate = rateLimiterService.allow(identity, operationClass, now);
            summary.rate = rate;
            if (!rate.allowed()) {
                return summary.finish(AdmissionResult.rateLimited(rate));
            }

            PolicyDecision policy = contentPolicyEngine.evaluate(
                    request.instruction(), request.facesDetected(), request.preserveIdentity());
            summary.policy = policy;
            if (!policy.allowed()) {
                return summary.finish(AdmissionResult.policyViolation(rate, policy));
            }

            String chargeReference = CHARGE_REFERENCE_PREFIX + admissionId;
            ChargeResult charge = creditLedgerService.charge(identity, cost, chargeReference,
                    Map.of("admissionId", admissionId.toString(), "operationClass", operationClass));
            summary.charge = charge;
            if (!charge.charged()) {
                return summary.finish(AdmissionResult.insufficientCredits(rate, policy, cost, charge.balanceAfter()));
            }

            long chargedCost = charge.privileged() ? 0 : cost;
            storeAdmission(identity, admissionId, operationClass, chargedCost,
                    charge.privileged() ? null : chargeReference, policy, now);

            return summary.finish(AdmissionResult.admitted(admissionId, rate, policy, chargedCost,
                    charge.privileged(), charge.balanceAfter()));
        } catch (StoreUnavailableException ex) {
            summary.failStore(ex);
            throw ex;
        }
    }

    @Override
    public AdmissionDto reportOutcome(UUID admissionId, AuthenticatedIdentity identity, boolean succeeded,
                                      String failureReason) {
        Transition transition = storeExecutor.execute("admission.outcome", () -> {
            Admission locked = admissionRepository.findByIdForUpdate(admissionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Admission " + admissionId + " not found"));
            if (!identity.privileged() && !locked.isOwnedBy(identity.userId())) {
                throw new AccessDeniedException("Admission belongs to another user");
            }
            if (locked.getStatus() != AdmissionStatus.ADMITTED) {
                return new Transition(locked, false);
            }
            Instant now = clock.instant();
            if (succeeded) {
                locked.transitionTo(AdmissionStatus.SUCCEEDED, now);
            } else {
                locked.setFailureReason(truncate(failureReason == null ? "operation failed" : failureReason));
                locked.transitionTo(AdmissionStatus.FAILED, now);
            }
            return new Transition(admissionRepository.save(locked), true);
        });

        Admission admission = transition.admission();
        if (!transition.changed()) {
            log.debug("Outcome for admission {} already reported: {}", admissionId, admission.getStatus());
            return admissionMapper.toDto(admission);
        }
        if (succeeded) {
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.OPERATION_SUCCEEDED)
                    .userId(admission.getUserId())
                    .action(admission.getOperationClass())
                    .detail("admissionId", admission.getId())
                    .detail("cost", admission.getCost())
                    .build());
        } else if (admission.getCost() > 0) {
            admission = compensate(admission);
        } else {
            auditLogWriter.record(AuditEntry.builder()
                    .eventType(AuditEventType.OPERATION_FAILED)
                    .userId(admission.getUserId())
                    .action(admission.getOperationClass())
                    .status(AuditStatus.FAILURE)
                    .detail("admissionId", admission.getId())
                    .detail("failureReason", admission.getFailureReason())
                    .build());
        }
        return admissionMapper.toDto(admission);
    }

    @Override
    public AdmissionDto getAdmission(UUID admissionId, AuthenticatedIdentity identity) {
        Admission admission = storeExecutor.execute("admission.get", () -> admissionRepository.findById(admissionId))
                .orElseThrow(() -> new ResourceNotFoundException("Admission " + admissionId + " not found"));
        if (!identity.privileged() && !admission.isOwnedBy(identity.userId())) {
            throw new AccessDeniedException("Admission belongs to another user");
        }
        return admissionMapper.toDto(admission);
    }

    @Override
    public int expireStaleAdmissions(Instant now) {
        Instant cutoff = now.minus(admissionProperties.getOutcomeTimeout());
        PageRequest batch = PageRequest.of(0, admissionProperties.getSweepBatchSize());
        int compensated = 0;

        List<UUID> stale = storeExecutor.execute("admission.sweep",
                () -> admissionRepository.findStaleIds(AdmissionStatus.ADMITTED, cutoff, batch));
        for (UUID id : stale) {
            try {
                Admission failed = storeExecutor.execute("admission.expire", () -> {
                    Admission locked = admissionRepository.findByIdForUpdate(id).orElse(null);
                    if (locked == null || locked.getStatus() != AdmissionStatus.ADMITTED) {
                        return null;
                    }
                    locked.setFailureReason(TIMEOUT_REASON);
                    locked.transitionTo(AdmissionStatus.FAILED, now);
                    return admissionRepository.save(locked);
                });
                if (failed != null) {
                    compensate(failed);
                    compensated++;
                }
            } catch (RuntimeException ex) {
                log.error("Could not expire admission {}: {}", id, ex.getMessage(), ex);
            }
        }

        List<UUID> interrupted = storeExecutor.execute("admission.sweep",
                () -> admissionRepository.findStaleIds(AdmissionStatus.FAILED, cutoff, batch));
        for (UUID id : interrupted) {
            try {
                Admission failed = storeExecutor.execute("admission.get", () -> admissionRepository.findById(id))
                        .orElse(null);
                if (failed != null && failed.getStatus() == AdmissionStatus.FAILED) {
                    compensate(failed);
                    compensated++;
                }
            } catch (RuntimeException ex) {
                log.error("Could not finish refund of admission {}: {}", id, ex.getMessage(), ex);
            }
        }

        if (compensated > 0) {
            log.info("Compensated {} stale admissions older than {}", compensated, cutoff);
        }
        return compensated;
    }

    @Scheduled(cron = "${admission.sweep-cron:0 */5 * * * *}")
    public void sweepStaleAdmissions() {
        try {
            expireStaleAdmissions(clock.instant());
        } catch (Exception e) {
            log.error("Stale admission sweep failed: {}", e.getMessage(), e);
        }
    }

    private Admission compensate(Admission admission) {
        RefundResult refund = creditLedgerService.refund(admission.getUserId(), admission.getCost(),
                admission.getId().toString(), admission.getFailureReason());

        AdmissionStatus next = refund.outcome() == RefundResult.Outcome.ESCALATED
                ? AdmissionStatus.REFUND_ESCALATED
                : AdmissionStatus.REFUNDED;

        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.OPERATION_FAILED)
                .userId(admission.getUserId())
                .action(admission.getOperationClass())
                .severity(next == AdmissionStatus.REFUNDED ? AuditSeverity.WARNING : AuditSeverity.CRITICAL)
                .status(AuditStatus.FAILURE)
                .detail("admissionId", admission.getId())
                .detail("cost", admission.getCost())
                .detail("failureReason", admission.getFailureReason())
                .detail("refund", refund.outcome().name())
                .detail("balanceAfter", refund.balanceAfter())
                .build());

        try {
            return storeExecutor.execute("admission.compensated", () -> {
                Admission locked = admissionRepository.findByIdForUpdate(admission.getId()).orElseThrow();
                if (locked.getStatus() == AdmissionStatus.FAILED) {
                    locked.transitionTo(next, clock.instant());
                    return admissionRepository.save(locked);
                }
                return locked;
            });
        } catch (StoreUnavailableException ex) {
            // The sweep picks the row up again; the refund itself is idempotent by reference
            log.error("Refund of admission {} settled as {} but the status update failed", admission.getId(), next);
            admission.setStatus(next);
            return admission;
        }
    }

    private void storeAdmission(AuthenticatedIdentity identity, UUID admissionId, String operationClass, long cost,
                                String chargeReference, PolicyDecision policy, Instant now) {
        Admission admission = new Admission();
        admission.setId(admissionId);
        admission.setUserId(identity.userId());
        admission.setOperationClass(operationClass);
        admission.setCost(cost);
        admission.setChargeReference(chargeReference);
        admission.setPrivileged(identity.privileged());
        admission.setRiskLevel(policy.riskLevel());
        admission.setStatus(AdmissionStatus.ADMITTED);
        admission.setCreatedAt(now);
        admission.setUpdatedAt(now);
        try {
            storeExecutor.execute("admission.store", () -> admissionRepository.saveAndFlush(admission));
        } catch (StoreUnavailableException ex) {
            if (cost > 0) {
                log.error("Admission {} was charged but could not be stored; refunding", admissionId);
                creditLedgerService.refund(identity.userId(), cost, admissionId.toString(), "admission record not stored");
            }
            throw ex;
        }
    }

    private long resolveCost(String operationClass, Long requestedCost) {
        long configured = admissionProperties.costFor(operationClass);
        if (requestedCost == null || requestedCost <= configured) {
            return configured;
        }
        return requestedCost;
    }

    private static String truncate(String value) {
        return value.length() <= 500 ? value : value.substring(0, 500);
    }

    private record Transition(Admission admission, boolean changed) {
    }

    /**
     * Collects the outcome of each evaluated step and writes the single audit record of an attempt.
     */
    private final class AttemptSummary {
        private final AuthenticatedIdentity identity;
        private final AdmissionRequest request;
        private final UUID admissionId;
        private final long cost;
        private RateDecision rate;
        private PolicyDecision policy;
        private ChargeResult charge;

        private AttemptSummary(AuthenticatedIdentity identity, AdmissionRequest request, UUID admissionId, long cost) {
            this.identity = identity;
            this.request = request;
            this.admissionId = admissionId;
            this.cost = cost;
        }

        AdmissionResult finish(AdmissionResult result) {
            AuditEventType eventType;
            AuditSeverity severity = AuditSeverity.INFO;
            if (result.allowed()) {
                eventType = AuditEventType.ADMISSION_GRANTED;
            } else {
                severity = AuditSeverity.WARNING;
                eventType = switch (result.reason()) {
                    case RATE_LIMITED -> AuditEventType.RATE_LIMIT_EXCEEDED;
                    case POLICY_VIOLATION -> AuditEventType.POLICY_VIOLATION;
                    case INSUFFICIENT_CREDITS -> AuditEventType.INSUFFICIENT_CREDITS;
                };
            }
            write(eventType, severity, result.allowed() ? AuditStatus.SUCCESS : AuditStatus.FAILURE,
                    result.allowed() ? "admitted" : result.reason().wireName(), null);
            meterRegistry.counter("admission.decisions", "outcome",
                    result.allowed() ? "admitted" : result.reason().wireName()).increment();
            log.info("Admission {} for {} on {}: {}", admissionId, identity.userId(), request.operationClass(),
                    result.allowed() ? "admitted" : result.reason().wireName());
            return result;
        }

        void failStore(StoreUnavailableException ex) {
            write(AuditEventType.ADMISSION_FAILED, AuditSeverity.ERROR, AuditStatus.FAILURE, "store-unavailable",
                    ex.getOperation());
            meterRegistry.counter("admission.decisions", "outcome", "store-unavailable").increment();
        }

        private void write(AuditEventType eventType, AuditSeverity severity, AuditStatus status, String outcome,
                           String failedOperation) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("admissionId", admissionId);
            details.put("operationClass", request.operationClass());
            details.put("outcome", outcome);
            details.put("cost", cost);
            details.put("privileged", identity.privileged());
            details.put("facesDetected", request.facesDetected());
            details.put("preserveIdentity", request.preserveIdentity());
            details.put("instruction", request.instruction());
            if (rate != null) {
                Map<String, Object> rateDetails = new LinkedHashMap<>();
                rateDetails.put("allowed", rate.allowed());
                rateDetails.put("bypassed", rate.bypassed());
                rateDetails.put("count", rate.count());
                rateDetails.put("limit", rate.limit());
                rateDetails.put("resetAt", rate.resetAt());
                details.put("rateLimit", rateDetails);
            }
            if (policy != null) {
                Map<String, Object> policyDetails = new LinkedHashMap<>();
                policyDetails.put("allowed", policy.allowed());
                policyDetails.put("riskLevel", policy.riskLevel().wireName());
                policyDetails.put("rule", policy.rule().wireName());
                policyDetails.put("matchedTerm", policy.matchedTerm());
                details.put("policy", policyDetails);
            }
            if (charge != null) {
                Map<String, Object> chargeDetails = new LinkedHashMap<>();
                chargeDetails.put("charged", charge.charged());
                chargeDetails.put("waived", charge.privileged());
                chargeDetails.put("balanceAfter", charge.balanceAfter());
                details.put("charge", chargeDetails);
            }
            if (failedOperation != null) {
                details.put("failedOperation", failedOperation);
            }

            auditLogWriter.record(AuditEntry.builder()
                    .eventType(eventType)
                    .userId(identity.userId())
                    .action("admit:" + request.operationClass())
                    .severity(severity)
                    .status(status)
                    .details(details)
                    .build());
        }
    }
}
