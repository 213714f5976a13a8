package uk.gegc.imagestudio.features.ratelimit.domain.model;

import java.time.Instant;

/**
 * Read-only view of a window. An absent or ended window reports zero requests and no reset time.
 */
public record RateLimitStatus(
        String userId,
        String operationClass,
        int count,
        int limit,
        int remaining,
        Instant resetAt
) {
}
