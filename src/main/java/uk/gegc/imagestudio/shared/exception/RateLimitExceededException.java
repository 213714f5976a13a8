package uk.gegc.imagestudio.shared.exception;

import java.time.Instant;

public class RateLimitExceededException extends RuntimeException {
    private final long retryAfterSeconds;
    private final Instant resetAt;
    private final int limit;

    public RateLimitExceededException(String message, Instant resetAt, long retryAfterSeconds, int limit) {
        super(message);
        this.resetAt = resetAt;
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
        this.limit = limit;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public Instant getResetAt() {
        return resetAt;
    }

    public int getLimit() {
        return limit;
    }
}
