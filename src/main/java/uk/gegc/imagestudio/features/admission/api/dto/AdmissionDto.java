package uk.gegc.imagestudio.features.admission.api.dto;

import uk.gegc.imagestudio.features.admission.domain.model.AdmissionStatus;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;

import java.time.Instant;
import java.util.UUID;

public record AdmissionDto(
        UUID id,
        String userId,
        String operationClass,
        long cost,
        boolean privileged,
        RiskLevel riskLevel,
        AdmissionStatus status,
        String failureReason,
        Instant createdAt,
        Instant completedAt
) {}
