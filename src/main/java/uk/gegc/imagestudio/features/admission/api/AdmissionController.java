package uk.gegc.imagestudio.features.admission.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import uk.gegc.imagestudio.features.admission.api.dto.AdmissionDto;
import uk.gegc.imagestudio.features.admission.api.dto.AdmissionResponse;
import uk.gegc.imagestudio.features.admission.api.dto.AdmitOperationRequest;
import uk.gegc.imagestudio.features.admission.api.dto.ReportOutcomeRequest;
import uk.gegc.imagestudio.features.admission.application.AdmissionOrchestrator;
import uk.gegc.imagestudio.features.admission.application.AdmissionRequest;
import uk.gegc.imagestudio.features.admission.application.AdmissionResult;
import uk.gegc.imagestudio.features.ledger.domain.exception.InsufficientCreditsException;
import uk.gegc.imagestudio.features.policy.domain.exception.PolicyViolationException;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateDecision;
import uk.gegc.imagestudio.shared.exception.RateLimitExceededException;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.time.Clock;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admissions")
@RequiredArgsConstructor
@Tag(name = "Admissions", description = "Admission of paid image operations")
@SecurityRequirement(name = "Bearer Authentication")
public class AdmissionController {

    private final AdmissionOrchestrator admissionOrchestrator;
    private final Clock clock;

    @Operation(
            summary = "Admit an image operation",
            description = "Checks the rate limit, the content policy and the credit balance, in that order, and charges "
                    + "the operation's cost. Call this before invoking the image service."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Admitted and charged",
                    content = @Content(schema = @Schema(implementation = AdmissionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or unknown operation class",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid identity token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Not enough credits; the body links to the top-up page",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Instruction violates the content policy",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Rate limit reached; see Retry-After",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Store unavailable; nothing was charged",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<AdmissionResponse> admit(@Valid @RequestBody AdmitOperationRequest request,
                                                   @AuthenticationPrincipal AuthenticatedIdentity identity) {
        AdmissionRequest admissionRequest = new AdmissionRequest(
                request.operationClass().trim(),
                request.cost(),
                request.instruction(),
                request.facesDetected() == null ? 0 : request.facesDetected(),
                request.preserveIdentity() == null || request.preserveIdentity());

        AdmissionResult result = admissionOrchestrator.admit(identity, admissionRequest);
        if (!result.allowed()) {
            throw toException(result);
        }

        RateDecision rate = result.rateDecision();
        return ResponseEntity.ok(new AdmissionResponse(
                true,
                result.admissionId(),
                result.riskLevel(),
                result.cost(),
                result.balanceAfter(),
                rate.bypassed() ? null : rate.remaining(),
                rate.resetAt()));
    }

    @Operation(summary = "Report the outcome of an admitted operation",
            description = "A failure refunds the charge. Reporting again returns the admission unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Outcome recorded",
                    content = @Content(schema = @Schema(implementation = AdmissionDto.class))),
            @ApiResponse(responseCode = "403", description = "Admission belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown admission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{admissionId}/outcome")
    public ResponseEntity<AdmissionDto> reportOutcome(@PathVariable UUID admissionId,
                                                      @Valid @RequestBody ReportOutcomeRequest request,
                                                      @AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ResponseEntity.ok(admissionOrchestrator.reportOutcome(
                admissionId, identity, request.succeeded(), request.failureReason()));
    }

    @Operation(summary = "Get an admission")
    @GetMapping("/{admissionId}")
    public ResponseEntity<AdmissionDto> getAdmission(@PathVariable UUID admissionId,
                                                     @AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ResponseEntity.ok(admissionOrchestrator.getAdmission(admissionId, identity));
    }

    private RuntimeException toException(AdmissionResult result) {
        return switch (result.reason()) {
            case RATE_LIMITED -> {
                RateDecision rate = result.rateDecision();
                yield new RateLimitExceededException(
                        "Rate limit of " + rate.limit() + " requests reached",
                        rate.resetAt(),
                        rate.retryAfterSeconds(clock.instant()),
                        rate.limit());
            }
            case POLICY_VIOLATION -> new PolicyViolationException(result.policyDecision());
            case INSUFFICIENT_CREDITS -> new InsufficientCreditsException(
                    "Insufficient credits: " + result.cost() + " required",
                    result.cost(),
                    result.balanceAfter() == null ? 0 : result.balanceAfter());
        };
    }
}
