package uk.gegc.imagestudio.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background sweeps (rate window retention, stale admissions, payment
 * reconciliation, ledger integrity). Switched off in tests, which call the sweeps directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "imagestudio.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
