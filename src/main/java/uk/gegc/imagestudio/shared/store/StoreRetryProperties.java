package uk.gegc.imagestudio.shared.store;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Bounded retry for transient store failures (lock timeouts, deadlocks, row-creation races).
 */
@Configuration
@ConfigurationProperties(prefix = "store.retry")
@Validated
@Data
public class StoreRetryProperties {

    /**
     * Total attempts including the first one.
     */
    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private Duration initialBackoff = Duration.ofMillis(20);

    @DecimalMin("1.0")
    private double multiplier = 2.0d;
}
