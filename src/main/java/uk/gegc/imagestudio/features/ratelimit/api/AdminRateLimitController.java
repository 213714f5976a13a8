package uk.gegc.imagestudio.features.ratelimit.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.imagestudio.features.ratelimit.api.dto.RateLimitStatusDto;
import uk.gegc.imagestudio.features.ratelimit.api.dto.ResetRateLimitRequest;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

@RestController
@RequestMapping("/api/v1/admin/rate-limits")
@RequiredArgsConstructor
@Tag(name = "Rate Limits Admin")
@SecurityRequirement(name = "Bearer Authentication")
public class AdminRateLimitController {

    private final RateLimiterService rateLimiterService;

    @Operation(summary = "Reset a user's window", description = "The window restarts now with a zero count.")
    @PostMapping("/reset")
    public ResponseEntity<RateLimitStatusDto> reset(@Valid @RequestBody ResetRateLimitRequest request,
                                                    @AuthenticationPrincipal AuthenticatedIdentity admin) {
        return ResponseEntity.ok(RateLimitController.toDto(
                rateLimiterService.reset(admin.userId(), request.userId(), request.operationClass())));
    }
}
