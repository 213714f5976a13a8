package uk.gegc.imagestudio.features.ratelimit.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one rate-limit check.
 *
 * @param bypassed true for privileged callers, whose windows are never touched
 */
public record RateDecision(
        boolean allowed,
        int count,
        int limit,
        int remaining,
        Instant resetAt,
        boolean bypassed
) {

    public static RateDecision bypass(int limit) {
        return new RateDecision(true, 0, limit, limit, null, true);
    }

    public static RateDecision allowed(int count, int limit, Instant resetAt) {
        return new RateDecision(true, count, limit, Math.max(0, limit - count), resetAt, false);
    }

    public static RateDecision denied(int count, int limit, Instant resetAt) {
        return new RateDecision(false, count, limit, 0, resetAt, false);
    }

    /**
     * Whole seconds until the window resets, rounded up, never below one.
     */
    public long retryAfterSeconds(Instant now) {
        if (resetAt == null) {
            return 1;
        }
        long millis = Duration.between(now, resetAt).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
