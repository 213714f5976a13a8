package uk.gegc.imagestudio.features.payment.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Paystack configuration: API credentials, timeouts, the reconciliation sweep and the product catalog.
 */
@Configuration
@ConfigurationProperties(prefix = "paystack")
@Validated
@Data
public class PaystackProperties {

    /** Secret API key. Also the HMAC key for webhook signatures. */
    @NotBlank
    private String secretKey;

    @NotBlank
    private String baseUrl = "https://api.paystack.co";

    /** Where Paystack redirects the customer after checkout. */
    private String callbackUrl;

    @NotBlank
    private String currency = "NGN";

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(15);

    /** Pending payments younger than this are left for the webhook. */
    @NotNull
    private Duration reconcileLookback = Duration.ofHours(1);

    @Positive
    private int reconcileBatchSize = 50;

    /** One-off credit packages, keyed by package id. */
    @Valid
    private Map<String, CatalogItem> packages = new LinkedHashMap<>();

    /** Recurring plans, keyed by plan id. */
    @Valid
    private Map<String, CatalogItem> plans = new LinkedHashMap<>();

    public Optional<CatalogItem> findPackage(String packageId) {
        return Optional.ofNullable(packageId).map(packages::get);
    }

    public Optional<CatalogItem> findPlan(String planId) {
        return Optional.ofNullable(planId).map(plans::get);
    }

    @Data
    public static class CatalogItem {
        @NotBlank
        private String name;

        @Positive
        private long credits;

        /** Price in the major currency unit. */
        @Positive
        private long price;

        /** Paystack plan code; when set, checkout enrols the customer in the recurring plan. */
        private String planCode;
    }
}
