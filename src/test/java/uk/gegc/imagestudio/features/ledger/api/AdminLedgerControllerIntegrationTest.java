package uk.gegc.imagestudio.features.ledger.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import uk.gegc.imagestudio.BaseIntegrationTest;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.application.ManualReconciliationService;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static uk.gegc.imagestudio.testsupport.IdentityTokens.adminBearer;
import static uk.gegc.imagestudio.testsupport.IdentityTokens.bearer;

@DisplayName("Admin ledger endpoints")
class AdminLedgerControllerIntegrationTest extends BaseIntegrationTest {

    private static final String USER = "customer-7";

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Autowired
    private ManualReconciliationService manualReconciliationService;

    @BeforeEach
    void clean() {
        truncateAll();
    }

    @Test
    @DisplayName("regular users are refused")
    void nonAdmin() throws Exception {
        mockMvc.perform(get("/api/v1/admin/ledger/{userId}/integrity", USER)
                        .header("Authorization", bearer(USER)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("an adjustment is applied once per idempotency key")
    void adjust() throws Exception {
        String body = """
                {"userId":"%s","amount":25,"reason":"support goodwill","idempotencyKey":"ticket-42"}
                """.formatted(USER);

        mockMvc.perform(post("/api/v1/admin/ledger/adjustments")
                        .header("Authorization", adminBearer("ops"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanceAfter").value(25))
                .andExpect(jsonPath("$.duplicate").value(false));

        mockMvc.perform(post("/api/v1/admin/ledger/adjustments")
                        .header("Authorization", adminBearer("ops"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));

        assertThat(creditLedgerService.getBalance(USER).balance()).isEqualTo(25);
    }

    @Test
    @DisplayName("an overdrawing adjustment is a 402")
    void overdraw() throws Exception {
        mockMvc.perform(post("/api/v1/admin/ledger/adjustments")
                        .header("Authorization", adminBearer("ops"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId":"%s","amount":-5,"reason":"correction","idempotencyKey":"ticket-43"}
                                """.formatted(USER)))
                .andExpect(status().isPaymentRequired());
    }

    @Test
    @DisplayName("integrity check reports a balanced account")
    void integrity() throws Exception {
        creditLedgerService.allocate(USER, 40, "seed-1", LedgerEntrySource.ADMIN, Map.of());

        mockMvc.perform(get("/api/v1/admin/ledger/{userId}/integrity", USER)
                        .header("Authorization", adminBearer("ops")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanced").value(true))
                .andExpect(jsonPath("$.actualBalance").value(40));
    }

    @Test
    @DisplayName("integrity check detects a tampered balance")
    void drift() throws Exception {
        creditLedgerService.allocate(USER, 40, "seed-1", LedgerEntrySource.ADMIN, Map.of());
        jdbcTemplate.update("UPDATE ledger_accounts SET balance = 55 WHERE user_id = ?", USER);

        mockMvc.perform(get("/api/v1/admin/ledger/{userId}/integrity", USER)
                        .header("Authorization", adminBearer("ops")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanced").value(false))
                .andExpect(jsonPath("$.calculatedBalance").value(40));
    }

    @Test
    @DisplayName("manual reconciliation records can be listed and resolved once")
    void manualReconciliation() throws Exception {
        UUID id = manualReconciliationService.open(USER, 3, "refund:adm-1", "refund failed");

        mockMvc.perform(get("/api/v1/admin/ledger/manual-reconciliations")
                        .param("status", "OPEN")
                        .header("Authorization", adminBearer("ops")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].reference").value("refund:adm-1"));

        mockMvc.perform(post("/api/v1/admin/ledger/manual-reconciliations/{id}/resolve", id)
                        .header("Authorization", adminBearer("ops"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"credited by hand\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resolvedBy").value("ops"));

        mockMvc.perform(post("/api/v1/admin/ledger/manual-reconciliations/{id}/resolve", id)
                        .header("Authorization", adminBearer("ops"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"note\":\"again\"}"))
                .andExpect(status().isConflict());
    }
}
