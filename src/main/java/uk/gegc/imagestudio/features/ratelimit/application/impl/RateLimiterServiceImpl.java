package uk.gegc.imagestudio.features.ratelimit.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uk.gegc.imagestudio.features.audit.application.AuditEntry;
import uk.gegc.imagestudio.features.audit.application.AuditLogWriter;
import uk.gegc.imagestudio.features.audit.domain.model.AuditEventType;
import uk.gegc.imagestudio.features.audit.domain.model.AuditSeverity;
import uk.gegc.imagestudio.features.audit.domain.model.AuditStatus;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimitProperties;
import uk.gegc.imagestudio.features.ratelimit.application.RateLimiterService;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateDecision;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateLimitStatus;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateWindow;
import uk.gegc.imagestudio.features.ratelimit.infra.repository.RateWindowRepository;
import uk.gegc.imagestudio.shared.exception.RateLimitExceededException;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;
import uk.gegc.imagestudio.shared.store.StoreTransactionExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterServiceImpl implements RateLimiterService {

    private final RateWindowRepository rateWindowRepository;
    private final RateLimitProperties properties;
    private final StoreTransactionExecutor storeExecutor;
    private final AuditLogWriter auditLogWriter;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public RateDecision allow(AuthenticatedIdentity identity, String operationClass, Instant now) {
        RateLimitProperties.OperationLimit config = properties.limitFor(operationClass);
        int limit = config.getLimit();
        long durationMs = config.getWindow().toMillis();

        if (identity.privileged()) {
            return RateDecision.bypass(limit);
        }

        String userId = identity.userId();
        RateDecision decision = storeExecutor.execute("ratelimit.allow", () -> {
            Optional<RateWindow> existing = rateWindowRepository.findByKeyForUpdate(RateWindow.keyOf(userId, operationClass));
            if (existing.isEmpty()) {
                RateWindow window = RateWindow.open(userId, operationClass, limit, durationMs, now);
                window.increment(now);
                // Flush inside the attempt so a concurrent first insert fails here and is retried against the winner's row
                rateWindowRepository.saveAndFlush(window);
                return RateDecision.allowed(window.getRequestCount(), limit, window.resetAt());
            }

            RateWindow window = existing.get();
            window.applyConfiguration(limit, durationMs);
            if (window.isExpired(now)) {
                window.restart(now);
            }
            if (window.getRequestCount() < limit) {
                window.increment(now);
                rateWindowRepository.save(window);
                return RateDecision.allowed(window.getRequestCount(), limit, window.resetAt());
            }
            return RateDecision.denied(window.getRequestCount(), limit, window.resetAt());
        });

        if (!decision.allowed()) {
            meterRegistry.counter("ratelimit.denied", "operation", operationClass).increment();
            log.info("Rate limit reached for user {} on {}: {}/{} until {}",
                    userId, operationClass, decision.count(), limit, decision.resetAt());
        }
        return decision;
    }

    @Override
    public RateDecision allow(AuthenticatedIdentity identity, String operationClass) {
        return allow(identity, operationClass, clock.instant());
    }

    @Override
    public void enforce(AuthenticatedIdentity identity, String operationClass) {
        Instant now = clock.instant();
        RateDecision decision = allow(identity, operationClass, now);
        if (decision.allowed()) {
            return;
        }
        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.RATE_LIMIT_EXCEEDED)
                .userId(identity.userId())
                .action("api:" + operationClass)
                .severity(AuditSeverity.WARNING)
                .status(AuditStatus.FAILURE)
                .detail("operationClass", operationClass)
                .detail("limit", decision.limit())
                .detail("resetAt", decision.resetAt())
                .build());
        throw new RateLimitExceededException(
                "Too many requests for " + operationClass,
                decision.resetAt(),
                decision.retryAfterSeconds(now),
                decision.limit());
    }

    @Override
    public RateLimitStatus status(String userId, String operationClass, Instant now) {
        RateLimitProperties.OperationLimit config = properties.limitFor(operationClass);
        int limit = config.getLimit();

        return storeExecutor.execute("ratelimit.status", () -> rateWindowRepository
                .findById(RateWindow.keyOf(userId, operationClass))
                .filter(window -> !window.isExpired(now))
                .map(window -> new RateLimitStatus(userId, operationClass, window.getRequestCount(), limit,
                        Math.max(0, limit - window.getRequestCount()), window.resetAt()))
                .orElseGet(() -> new RateLimitStatus(userId, operationClass, 0, limit, limit, null)));
    }

    @Override
    public RateLimitStatus reset(String adminUserId, String userId, String operationClass) {
        RateLimitProperties.OperationLimit config = properties.limitFor(operationClass);
        int limit = config.getLimit();
        long durationMs = config.getWindow().toMillis();
        Instant now = clock.instant();

        RateWindow window = storeExecutor.execute("ratelimit.reset", () -> {
            RateWindow target = rateWindowRepository.findByKeyForUpdate(RateWindow.keyOf(userId, operationClass))
                    .orElseGet(() -> RateWindow.open(userId, operationClass, limit, durationMs, now));
            target.applyConfiguration(limit, durationMs);
            target.restart(now);
            return rateWindowRepository.saveAndFlush(target);
        });

        log.info("Admin {} reset rate window {} for user {}", adminUserId, operationClass, userId);
        auditLogWriter.record(AuditEntry.builder()
                .eventType(AuditEventType.ADMIN_RATE_LIMIT_RESET)
                .userId(userId)
                .action("reset:" + operationClass)
                .detail("adminId", adminUserId)
                .detail("operationClass", operationClass)
                .build());

        return new RateLimitStatus(userId, operationClass, 0, limit, limit, window.resetAt());
    }

    @Override
    public int purgeExpired(Instant now) {
        Instant cutoff = now.minus(properties.getRetention());
        int batchSize = properties.getPurgeBatchSize();
        int deleted = 0;
        while (true) {
            int removed = storeExecutor.execute("ratelimit.purge", () -> {
                List<String> keys = rateWindowRepository.findKeysEndedBefore(cutoff, PageRequest.of(0, batchSize));
                if (!keys.isEmpty()) {
                    rateWindowRepository.deleteAllByIdInBatch(keys);
                }
                return keys.size();
            });
            deleted += removed;
            if (removed < batchSize) {
                break;
            }
        }
        if (deleted > 0) {
            log.info("Purged {} rate windows that ended before {}", deleted, cutoff);
        }
        return deleted;
    }

    /**
     * Hourly retention sweep.
     */
    @Scheduled(cron = "${ratelimit.purge-cron:0 15 * * * *}")
    public void purgeExpiredWindows() {
        try {
            purgeExpired(clock.instant());
        } catch (Exception e) {
            log.error("Rate window retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
