package uk.gegc.imagestudio.features.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

@Schema(name = "UserActivitySummaryDto", description = "Per-category activity counts for one user")
public record UserActivitySummaryDto(
        String userId,
        long totalEvents,
        @Schema(description = "Event count per category", example = "{\"image\": 12, \"billing\": 3}")
        Map<String, Long> eventsByCategory,
        long policyViolations,
        long rateLimitHits,
        Instant lastActivityAt
) {
}
