package uk.gegc.imagestudio.features.ratelimit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.ratelimit.api.dto.RateLimitStatusDto;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateLimitStatus;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.time.Clock;

@RestController
@RequestMapping("/api/v1/rate-limits")
@RequiredArgsConstructor
@Tag(name = "Rate Limits", description = "Inspect request windows")
@SecurityRequirement(name = "Bearer Authentication")
public class RateLimitController {

    private final RateLimiterService rateLimiterService;
    private final Clock clock;

    @Operation(
            summary = "Get rate limit status",
            description = "Returns the caller's window. Administrators may pass userId to inspect another user."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status returned",
                    content = @Content(schema = @Schema(implementation = RateLimitStatusDto.class))),
            @ApiResponse(responseCode = "400", description = "Unknown operation class",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Non-admin asked for another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/status")
    public ResponseEntity<RateLimitStatusDto> status(
            @Parameter(description = "Operation class", required = true) @RequestParam String operationClass,
            @Parameter(description = "Target user (admins only)") @RequestParam(required = false) String userId,
            @AuthenticationPrincipal AuthenticatedIdentity identity) {
        String target = identity.resolveTargetUser(userId);
        return ResponseEntity.ok(toDto(rateLimiterService.status(target, operationClass, clock.instant())));
    }

    static RateLimitStatusDto toDto(RateLimitStatus status) {
        return new RateLimitStatusDto(status.userId(), status.operationClass(), status.count(),
                status.limit(), status.remaining(), status.resetAt());
    }
}
