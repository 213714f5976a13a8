package uk.gegc.imagestudio.features.admission.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
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

@Configuration
@ConfigurationProperties(prefix = "admission")
@Validated
@Data
public class AdmissionProperties {

    /**
     * An admission whose outcome is not reported within this time is compensated as failed.
     */
    @NotNull
    private Duration outcomeTimeout = Duration.ofMinutes(15);

    @Positive
    private int sweepBatchSize = 100;

    /**
     * Where clients send users who run out of credits.
     */
    @NotBlank
    private String topUpUrl = "/billing";

    @Valid
    private Map<String, OperationCost> operations = new LinkedHashMap<>();

    public long costFor(String operationClass) {
        OperationCost cost = operationClass == null ? null : operations.get(operationClass);
        if (cost == null) {
            throw new UnknownOperationClassException(operationClass);
        }
        return cost.getCost();
    }

    @Data
    public static class OperationCost {
        @Positive
        private long cost;
    }
}
