package uk.gegc.imagestudio.features.ratelimit.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Fixed request-count window for one (user, operation class) pair.
 * Only the rate limiter mutates it, always under a row lock.
 */
@Entity
@Table(name = "rate_windows",
        uniqueConstraints = @UniqueConstraint(name = "uk_rate_window_user_op", columnNames = {"user_id", "operation_class"}),
        indexes = @Index(name = "idx_rate_window_end", columnList = "window_end"))
@Getter
@Setter
@NoArgsConstructor
public class RateWindow {

    @Id
    @Column(name = "window_key", nullable = false, updatable = false, length = 200)
    private String windowKey;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "operation_class", nullable = false, updatable = false, length = 64)
    private String operationClass;

    @Column(name = "request_count", nullable = false)
    private int requestCount;

    @Column(name = "window_limit", nullable = false)
    private int windowLimit;

    @Column(name = "window_duration_ms", nullable = false)
    private long windowDurationMs;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "window_end", nullable = false)
    private Instant windowEnd;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static String keyOf(String userId, String operationClass) {
        return operationClass + "|" + userId;
    }

    public static RateWindow open(String userId, String operationClass, int limit, long durationMs, Instant now) {
        RateWindow window = new RateWindow();
        window.setWindowKey(keyOf(userId, operationClass));
        window.setUserId(userId);
        window.setOperationClass(operationClass);
        window.setWindowLimit(limit);
        window.setWindowDurationMs(durationMs);
        window.restart(now);
        return window;
    }

    /**
     * A window ends once {@code now - windowStart >= windowDurationMs}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(resetAt());
    }

    public void restart(Instant now) {
        this.requestCount = 0;
        this.windowStart = now;
        this.windowEnd = now.plusMillis(windowDurationMs);
        this.updatedAt = now;
    }

    public void applyConfiguration(int limit, long durationMs) {
        this.windowLimit = limit;
        if (this.windowDurationMs != durationMs) {
            this.windowDurationMs = durationMs;
            this.windowEnd = windowStart.plusMillis(durationMs);
        }
    }

    public void increment(Instant now) {
        this.requestCount++;
        this.updatedAt = now;
    }

    public Instant resetAt() {
        return windowStart.plusMillis(windowDurationMs);
    }
}
