package uk.gegc.imagestudio.features.payment.infra.paystack;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;
import uk.gegc.imagestudio.features.payment.application.PaystackProperties;

import java.io.IOException;
import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class PaystackClientConfig {

    private final PaystackProperties properties;
    private final MeterRegistry meterRegistry;

    @Bean
    public RestTemplate paystackRestTemplate(RestTemplateBuilder builder) {
        RestTemplate restTemplate = builder
                .rootUri(properties.getBaseUrl())
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getSecretKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .additionalInterceptors(timingInterceptor())
                .build();

        log.info("Paystack client configured for {} (connect timeout {}, read timeout {})",
                properties.getBaseUrl(), properties.getConnectTimeout(), properties.getReadTimeout());
        return restTemplate;
    }

    private ClientHttpRequestInterceptor timingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            String path = request.getURI().getPath();
            try {
                ClientHttpResponse response = execution.execute(request, body);
                long duration = System.currentTimeMillis() - startTime;
                log.debug("Paystack {} {} -> {} in {}ms", request.getMethod(), path, response.getStatusCode(), duration);
                meterRegistry.timer("payment.gateway.requests",
                        "method", request.getMethod().name(),
                        "status", String.valueOf(response.getStatusCode().value())
                ).record(Duration.ofMillis(duration));
                return response;
            } catch (IOException e) {
                meterRegistry.counter("payment.gateway.errors",
                        "method", request.getMethod().name(),
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            }
        };
    }
}
