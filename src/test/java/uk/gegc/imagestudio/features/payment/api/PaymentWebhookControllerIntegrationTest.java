package uk.gegc.imagestudio.features.payment.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;
import uk.gegc.imagestudio.BaseIntegrationTest;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus;
import uk.gegc.imagestudio.features.payment.application.WebhookSignatureVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("POST /api/v1/payments/webhook")
class PaymentWebhookControllerIntegrationTest extends BaseIntegrationTest {

    private static final String USER = "paying-user";

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @Autowired
    private CreditLedgerService creditLedgerService;

    @BeforeEach
    void clean() {
        truncateAll();
    }

    private ResultActions deliver(String payload, String signature) throws Exception {
        return mockMvc.perform(post("/api/v1/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .header("x-paystack-signature", signature)
                .content(payload));
    }

    private static String chargeSuccess(String reference) {
        return """
                {"event":"charge.success","data":{"reference":"%s","status":"success","amount":50000,"currency":"NGN",
                 "metadata":{"userId":"%s","packageId":"starter","credits":50}}}""".formatted(reference, USER);
    }

    private long balance() {
        return creditLedgerService.getBalance(USER).balance();
    }

    @Test
    @DisplayName("a signed charge.success credits the account once, redelivery is acknowledged")
    void creditsOnce() throws Exception {
        String payload = chargeSuccess("ps_ref_1");
        String signature = signatureVerifier.sign(payload);

        deliver(payload, signature).andExpect(status().isOk());
        deliver(payload, signature).andExpect(status().isOk());

        assertThat(balance()).isEqualTo(50);
    }

    @Test
    @DisplayName("completes the pending entry recorded at checkout")
    void completesPending() throws Exception {
        creditLedgerService.recordPending(USER, 50, "ps_ref_2", LedgerEntrySource.PAYMENT, Map.of("packageId", "starter"));

        String payload = chargeSuccess("ps_ref_2");
        deliver(payload, signatureVerifier.sign(payload)).andExpect(status().isOk());

        assertThat(balance()).isEqualTo(50);
        assertThat(creditLedgerService.findByReference("ps_ref_2")).get()
                .extracting(entry -> entry.status()).isEqualTo(LedgerEntryStatus.COMPLETED);
    }

    @Test
    @DisplayName("a bad signature is rejected with 401 and changes nothing")
    void badSignature() throws Exception {
        deliver(chargeSuccess("ps_ref_3"), "0".repeat(128))
                .andExpect(status().isUnauthorized());

        assertThat(balance()).isZero();
        Integer audits = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM audit_records WHERE event_type = 'UNAUTHORIZED'", Integer.class);
        assertThat(audits).isEqualTo(1);
    }

    @Test
    @DisplayName("a missing signature is rejected with 401")
    void missingSignature() throws Exception {
        mockMvc.perform(post("/api/v1/payments/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(chargeSuccess("ps_ref_4")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("signed but malformed JSON is a 400")
    void malformed() throws Exception {
        String payload = "{\"event\":\"charge.success\"";

        deliver(payload, signatureVerifier.sign(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("unhandled events are acknowledged")
    void ignored() throws Exception {
        String payload = "{\"event\":\"transfer.success\",\"data\":{\"reference\":\"tr_1\"}}";

        deliver(payload, signatureVerifier.sign(payload)).andExpect(status().isOk());
        assertThat(balance()).isZero();
    }

    @Test
    @DisplayName("subscription.create then subscription.disable track the subscription")
    void subscriptionLifecycle() throws Exception {
        String create = """
                {"event":"subscription.create","data":{"subscription_code":"SUB_1","email_token":"tok",
                 "plan":{"plan_code":"PLN_basic","name":"Basic Monthly"},
                 "customer":{"email":"payer@example.com","metadata":{"userId":"%s","planId":"monthly_basic"}}}}"""
                .formatted(USER);
        deliver(create, signatureVerifier.sign(create)).andExpect(status().isOk());

        String disable = """
                {"event":"subscription.disable","data":{"subscription_code":"SUB_1"}}""";
        deliver(disable, signatureVerifier.sign(disable)).andExpect(status().isOk());

        String status = jdbcTemplate.queryForObject(
                "SELECT status FROM subscriptions WHERE subscription_code = 'SUB_1'", String.class);
        assertThat(status).isEqualTo("CANCELLED");
    }
}
