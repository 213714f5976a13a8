package uk.gegc.imagestudio.features.ratelimit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "RateLimitStatusDto", description = "Current request window for one operation class")
public record RateLimitStatusDto(
        @Schema(description = "User the window belongs to")
        String userId,

        @Schema(description = "Operation class", example = "generation")
        String operationClass,

        @Schema(description = "Requests counted in the current window", example = "3")
        int count,

        @Schema(description = "Configured limit per window", example = "18")
        int limit,

        @Schema(description = "Requests left before the limit is reached", example = "15")
        int remaining,

        @Schema(description = "When the current window ends; null when no window is open")
        Instant resetAt
) {}
