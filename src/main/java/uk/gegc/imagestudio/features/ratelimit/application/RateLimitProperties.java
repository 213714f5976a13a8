package uk.gegc.imagestudio.features.ratelimit.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.imagestudio.shared.exception.UnknownOperationClassException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-window limits per operation class. Callers name the class; the limit and window
 * always come from here.
 */
@Configuration
@ConfigurationProperties(prefix = "ratelimit")
@Validated
@Data
public class RateLimitProperties {

    /**
     * How long an ended window is kept before the retention sweep deletes it.
     */
    @NotNull
    private Duration retention = Duration.ofHours(24);

    @Positive
    private int purgeBatchSize = 500;

    @Valid
    private Map<String, OperationLimit> operations = new LinkedHashMap<>();

    /**
     * Window rows are keyed as {@code operationClass|userId}, so a class name may not contain the separator.
     */
    @AssertTrue(message = "operation class names must not be blank or contain '|'")
    public boolean isOperationNamesValid() {
        return operations.keySet().stream().allMatch(name -> name != null && !name.isBlank() && name.indexOf('|') < 0);
    }

    public OperationLimit limitFor(String operationClass) {
        OperationLimit limit = operationClass == null ? null : operations.get(operationClass);
        if (limit == null) {
            throw new UnknownOperationClassException(operationClass);
        }
        return limit;
    }

    @Data
    public static class OperationLimit {
        @Positive
        private int limit;

        @NotNull
        private Duration window = Duration.ofMinutes(1);
    }
}
