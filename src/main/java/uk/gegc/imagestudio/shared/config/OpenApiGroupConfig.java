package uk.gegc.imagestudio.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi admissionGroup() {
        return GroupedOpenApi.builder()
                .group("admission")
                .displayName("Admission & Rate Limits")
                .pathsToMatch("/api/v1/admissions/**", "/api/v1/rate-limits/**")
                .build();
    }

    @Bean
    public GroupedOpenApi billingGroup() {
        return GroupedOpenApi.builder()
                .group("billing")
                .displayName("Credits & Payments")
                .pathsToMatch("/api/v1/ledger/**", "/api/v1/payments/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Administration")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
