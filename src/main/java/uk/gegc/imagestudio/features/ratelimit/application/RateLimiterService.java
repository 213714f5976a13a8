package uk.gegc.imagestudio.features.ratelimit.application;

import uk.gegc.imagestudio.features.ratelimit.domain.model.RateDecision;
import uk.gegc.imagestudio.features.ratelimit.domain.model.RateLimitStatus;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.time.Instant;

/**
 * Fixed-window request limiter backed by the shared store, so every stateless handler sees
 * the same counts.
 */
public interface RateLimiterService {

    /**
     * Counts one request against the caller's window for {@code operationClass}.
     * Privileged callers are always allowed and their windows are not touched.
     *
     * @throws uk.gegc.imagestudio.shared.exception.UnknownOperationClassException if the class is not configured
     * @throws uk.gegc.imagestudio.shared.exception.StoreUnavailableException if the store fails; the request must be denied
     */
    RateDecision allow(AuthenticatedIdentity identity, String operationClass, Instant now);

    RateDecision allow(AuthenticatedIdentity identity, String operationClass);

    /**
     * Same as {@link #allow} but throws {@link uk.gegc.imagestudio.shared.exception.RateLimitExceededException}
     * on denial and audits it. Used to guard plain API endpoints.
     */
    void enforce(AuthenticatedIdentity identity, String operationClass);

    RateLimitStatus status(String userId, String operationClass, Instant now);

    /**
     * Administrative reset: the window restarts now with a zero count.
     */
    RateLimitStatus reset(String adminUserId, String userId, String operationClass);

    /**
     * Deletes windows that ended longer ago than the configured retention.
     *
     * @return number of windows deleted
     */
    int purgeExpired(Instant now);
}
