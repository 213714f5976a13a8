package uk.gegc.imagestudio.features.admission.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.imagestudio.features.policy.domain.model.RiskLevel;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AdmissionResponse", description = "A granted admission")
public record AdmissionResponse(
        @Schema(description = "Always true; denials are returned as problem documents")
        boolean allowed,

        @Schema(description = "Pass this back when reporting the outcome")
        UUID admissionId,

        @Schema(description = "Policy risk level", example = "low")
        RiskLevel riskLevel,

        @Schema(description = "Credits charged", example = "3")
        long creditsCharged,

        @Schema(description = "Balance after the charge; null for privileged callers")
        Long balanceAfter,

        @Schema(description = "Requests left in the current rate window; null for privileged callers")
        Integer remainingRequests,

        @Schema(description = "When the rate window resets; null for privileged callers")
        Instant resetAt
) {}
