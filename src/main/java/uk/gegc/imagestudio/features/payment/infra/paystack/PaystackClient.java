package uk.gegc.imagestudio.features.payment.infra.paystack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import uk.gegc.imagestudio.features.payment.application.PaymentGatewayClient;
import uk.gegc.imagestudio.features.payment.domain.exception.PaymentGatewayException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Paystack REST client. Every response is wrapped as {@code {status, message, data}}; a
 * {@code status} of false is treated as a gateway error.
 */
@Slf4j
@Component
public class PaystackClient implements PaymentGatewayClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public PaystackClient(@Qualifier("paystackRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public InitializedTransaction initializeTransaction(TransactionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", request.email());
        body.put("amount", request.amountMinor());
        if (request.currency() != null) {
            body.put("currency", request.currency());
        }
        if (request.callbackUrl() != null) {
            body.put("callback_url", request.callbackUrl());
        }
        if (request.planCode() != null) {
            body.put("plan", request.planCode());
        }
        if (request.metadata() != null && !request.metadata().isEmpty()) {
            body.put("metadata", request.metadata());
        }

        JsonNode data = call("initialize", () -> restTemplate.postForObject("/transaction/initialize", body, JsonNode.class));
        String authorizationUrl = data.path("authorization_url").asText(null);
        String reference = data.path("reference").asText(null);
        if (authorizationUrl == null || reference == null) {
            throw new PaymentGatewayException("initialize", "Paystack response is missing authorization_url or reference");
        }
        log.info("Initialized Paystack transaction reference={}", reference);
        return new InitializedTransaction(authorizationUrl, data.path("access_code").asText(null), reference);
    }

    @Override
    public GatewayTransaction verifyTransaction(String reference) {
        JsonNode data = call("verify",
                () -> restTemplate.getForObject("/transaction/verify/{reference}", JsonNode.class, reference));
        return new GatewayTransaction(
                data.path("reference").asText(reference),
                data.path("status").asText(null),
                data.path("amount").asLong(0),
                data.path("currency").asText(null),
                readMetadata(data.path("metadata")));
    }

    private JsonNode call(String operation, Supplier<JsonNode> request) {
        JsonNode response;
        try {
            response = request.get();
        } catch (HttpStatusCodeException e) {
            log.warn("Paystack {} returned {}: {}", operation, e.getStatusCode(), e.getResponseBodyAsString());
            throw new PaymentGatewayException(operation, "Paystack " + operation + " failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.warn("Paystack {} failed: {}", operation, e.getMessage());
            throw new PaymentGatewayException(operation, "Paystack " + operation + " is unreachable", e);
        }

        if (response == null || !response.path("status").asBoolean(false)) {
            String message = response == null ? "empty response" : response.path("message").asText("unknown error");
            throw new PaymentGatewayException(operation, "Paystack " + operation + " rejected: " + message);
        }
        JsonNode data = response.path("data");
        if (!data.isObject()) {
            throw new PaymentGatewayException(operation, "Paystack " + operation + " returned no data");
        }
        return data;
    }

    // Paystack echoes metadata either as an object or as the JSON string it was given.
    private Map<String, Object> readMetadata(JsonNode metadata) {
        if (metadata.isObject()) {
            return objectMapper.convertValue(metadata, MAP_TYPE);
        }
        if (metadata.isTextual() && !metadata.asText().isBlank()) {
            try {
                return objectMapper.readValue(metadata.asText(), MAP_TYPE);
            } catch (JsonProcessingException e) {
                log.debug("Ignoring non-JSON Paystack metadata: {}", e.getOriginalMessage());
            }
        }
        return Map.of();
    }
}
