package uk.gegc.imagestudio.shared.store;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.imagestudio.shared.exception.StoreUnavailableException;

import java.util.function.Supplier;

/**
 * Runs a unit of store work in its own short transaction.
 *
 * <p>{@link #execute} retries with exponential backoff when the failure is transient or a
 * concurrent insert won a uniqueness race; every retry re-reads state, so idempotency checks
 * inside the work see the winner's row. {@link #executeOnce} makes a single attempt.
 * In both cases a store failure surfaces as {@link StoreUnavailableException}; domain exceptions
 * thrown by the work pass through unchanged.
 */
@Slf4j
@Component
public class StoreTransactionExecutor {

    private final TransactionTemplate transactionTemplate;
    private final StoreRetryProperties retryProperties;
    private final MeterRegistry meterRegistry;

    public StoreTransactionExecutor(PlatformTransactionManager transactionManager,
                                    StoreRetryProperties retryProperties,
                                    MeterRegistry meterRegistry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.retryProperties = retryProperties;
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        int maxAttempts = Math.max(1, retryProperties.getMaxAttempts());
        long backoffMs = retryProperties.getInitialBackoff().toMillis();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (TransientDataAccessException | DataIntegrityViolationException ex) {
                if (attempts >= maxAttempts) {
                    log.warn("{} failed after {} attempts: {}", operation, attempts, ex.getMessage());
                    throw unavailable(operation, ex);
                }
                log.debug("{} attempt {} failed ({}), retrying in {} ms",
                        operation, attempts, ex.getClass().getSimpleName(), backoffMs);
                sleep(backoffMs);
                backoffMs = (long) Math.ceil(backoffMs * retryProperties.getMultiplier());
            } catch (DataAccessException | TransactionException ex) {
                throw unavailable(operation, ex);
            }
        }
    }

    public <T> T executeOnce(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException ex) {
            throw unavailable(operation, ex);
        }
    }

    private StoreUnavailableException unavailable(String operation, RuntimeException cause) {
        log.error("Store operation {} failed: {}", operation, cause.getMessage(), cause);
        meterRegistry.counter("store.failures", "operation", operation).increment();
        return new StoreUnavailableException(operation, cause);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
