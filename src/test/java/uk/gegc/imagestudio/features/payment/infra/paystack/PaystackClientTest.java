package uk.gegc.imagestudio.features.payment.infra.paystack;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import uk.gegc.imagestudio.features.payment.application.PaymentGatewayClient;
import uk.gegc.imagestudio.features.payment.application.PaystackProperties;
import uk.gegc.imagestudio.features.payment.domain.exception.PaymentGatewayException;

import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PaystackClient")
class PaystackClientTest {

    private WireMockServer wireMockServer;
    private PaystackClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        PaystackProperties properties = new PaystackProperties();
        properties.setSecretKey("sk_test_wiremock");
        properties.setBaseUrl("http://localhost:" + wireMockServer.port());
        properties.setReadTimeout(Duration.ofMillis(500));

        PaystackClientConfig config = new PaystackClientConfig(properties, new SimpleMeterRegistry());
        client = new PaystackClient(config.paystackRestTemplate(new RestTemplateBuilder()), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Nested
    @DisplayName("initializeTransaction")
    class Initialize {

        @Test
        @DisplayName("posts amount, e-mail and metadata with the bearer key")
        void initializes() {
            wireMockServer.stubFor(post(urlEqualTo("/transaction/initialize"))
                    .willReturn(okJson("""
                            {"status":true,"message":"Authorization URL created",
                             "data":{"authorization_url":"https://checkout.paystack.com/abc",
                                     "access_code":"abc","reference":"ref-123"}}
                            """)));

            PaymentGatewayClient.InitializedTransaction transaction = client.initializeTransaction(
                    new PaymentGatewayClient.TransactionRequest("jane@example.com", 50_000, "NGN",
                            "https://studio/callback", null, Map.of("userId", "user-1", "credits", 50)));

            assertThat(transaction.authorizationUrl()).isEqualTo("https://checkout.paystack.com/abc");
            assertThat(transaction.reference()).isEqualTo("ref-123");
            wireMockServer.verify(postRequestedFor(urlEqualTo("/transaction/initialize"))
                    .withHeader("Authorization", equalTo("Bearer sk_test_wiremock"))
                    .withRequestBody(matchingJsonPath("$.amount", equalTo("50000")))
                    .withRequestBody(matchingJsonPath("$.email", equalTo("jane@example.com")))
                    .withRequestBody(matchingJsonPath("$.callback_url", equalTo("https://studio/callback")))
                    .withRequestBody(matchingJsonPath("$.metadata.userId", equalTo("user-1"))));
        }

        @Test
        @DisplayName("status false is a gateway error")
        void rejected() {
            wireMockServer.stubFor(post(urlEqualTo("/transaction/initialize"))
                    .willReturn(okJson("{\"status\":false,\"message\":\"Invalid key\"}")));

            assertThatThrownBy(() -> client.initializeTransaction(new PaymentGatewayClient.TransactionRequest(
                    "jane@example.com", 100, "NGN", null, null, Map.of())))
                    .isInstanceOf(PaymentGatewayException.class)
                    .hasMessageContaining("Invalid key");
        }

        @Test
        @DisplayName("HTTP 5xx is a gateway error")
        void serverError() {
            wireMockServer.stubFor(post(urlEqualTo("/transaction/initialize"))
                    .willReturn(aResponse().withStatus(503)));

            assertThatThrownBy(() -> client.initializeTransaction(new PaymentGatewayClient.TransactionRequest(
                    "jane@example.com", 100, "NGN", null, null, Map.of())))
                    .isInstanceOf(PaymentGatewayException.class)
                    .hasMessageContaining("503");
        }
    }

    @Nested
    @DisplayName("verifyTransaction")
    class Verify {

        @Test
        @DisplayName("returns status, amount and object metadata")
        void verifies() {
            wireMockServer.stubFor(get(urlEqualTo("/transaction/verify/ref-123"))
                    .willReturn(okJson("""
                            {"status":true,"message":"Verification successful",
                             "data":{"reference":"ref-123","status":"success","amount":50000,"currency":"NGN",
                                     "metadata":{"userId":"user-1","credits":50}}}
                            """)));

            PaymentGatewayClient.GatewayTransaction transaction = client.verifyTransaction("ref-123");

            assertThat(transaction.succeeded()).isTrue();
            assertThat(transaction.amountMinor()).isEqualTo(50_000);
            assertThat(transaction.metadata()).containsEntry("userId", "user-1");
        }

        @Test
        @DisplayName("abandoned transactions are terminal failures; string metadata is parsed")
        void abandoned() {
            wireMockServer.stubFor(get(urlEqualTo("/transaction/verify/ref-9"))
                    .willReturn(okJson("""
                            {"status":true,"data":{"reference":"ref-9","status":"abandoned","amount":100,
                             "metadata":"{\\"userId\\":\\"user-2\\"}"}}
                            """)));

            PaymentGatewayClient.GatewayTransaction transaction = client.verifyTransaction("ref-9");

            assertThat(transaction.succeeded()).isFalse();
            assertThat(transaction.terminallyFailed()).isTrue();
            assertThat(transaction.metadata()).containsEntry("userId", "user-2");
        }

        @Test
        @DisplayName("unknown reference (404) is a gateway error")
        void notFound() {
            wireMockServer.stubFor(get(urlEqualTo("/transaction/verify/missing"))
                    .willReturn(aResponse().withStatus(404).withBody("{\"status\":false}")));

            assertThatThrownBy(() -> client.verifyTransaction("missing"))
                    .isInstanceOf(PaymentGatewayException.class);
        }
    }
}
