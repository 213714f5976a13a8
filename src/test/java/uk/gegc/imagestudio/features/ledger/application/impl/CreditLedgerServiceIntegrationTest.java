package uk.gegc.imagestudio.features.ledger.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import uk.gegc.imagestudio.BaseIntegrationTest;
import uk.gegc.imagestudio.features.ledger.api.dto.LedgerEntryDto;
import uk.gegc.imagestudio.features.ledger.application.AllocationResult;
import uk.gegc.imagestudio.features.ledger.application.ChargeResult;
import uk.gegc.imagestudio.features.ledger.application.CreditLedgerService;
import uk.gegc.imagestudio.features.ledger.application.LedgerIntegrityService;
import uk.gegc.imagestudio.features.ledger.application.RefundResult;
import uk.gegc.imagestudio.features.ledger.domain.exception.InsufficientCreditsException;
import uk.gegc.imagestudio.features.ledger.domain.exception.LedgerReferenceConflictException;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryKind;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus;
import uk.gegc.imagestudio.shared.security.AuthenticatedIdentity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CreditLedgerService against the store")
class CreditLedgerServiceIntegrationTest extends BaseIntegrationTest {

    private static final String USER = "ledger-user";

    @Autowired
    private CreditLedgerService ledger;

    @Autowired
    private LedgerIntegrityService integrityService;

    @BeforeEach
    void clean() {
        truncateAll();
    }

    private long balance() {
        return ledger.getBalance(USER).balance();
    }

    @Nested
    @DisplayName("charge")
    class Charge {

        @Test
        @DisplayName("debits the balance and records the remaining credits")
        void debits() {
            ledger.allocate(USER, 10, "seed-1", LedgerEntrySource.ADMIN, Map.of());

            ChargeResult result = ledger.charge(AuthenticatedIdentity.user(USER), 3, "charge:a", Map.of());

            assertThat(result.charged()).isTrue();
            assertThat(result.balanceAfter()).isEqualTo(7L);
            assertThat(balance()).isEqualTo(7);
        }

        @Test
        @DisplayName("refuses without touching the balance when funds are short")
        void insufficient() {
            ledger.allocate(USER, 2, "seed-1", LedgerEntrySource.ADMIN, Map.of());

            ChargeResult result = ledger.charge(AuthenticatedIdentity.user(USER), 3, "charge:a", Map.of());

            assertThat(result.charged()).isFalse();
            assertThat(result.balanceAfter()).isEqualTo(2L);
            assertThat(balance()).isEqualTo(2);
            assertThat(ledger.findByReference("charge:a")).isEmpty();
        }

        @Test
        @DisplayName("the same reference is charged once")
        void idempotent() {
            ledger.allocate(USER, 10, "seed-1", LedgerEntrySource.ADMIN, Map.of());

            ChargeResult first = ledger.charge(AuthenticatedIdentity.user(USER), 4, "charge:a", Map.of());
            ChargeResult second = ledger.charge(AuthenticatedIdentity.user(USER), 4, "charge:a", Map.of());

            assertThat(second.entryId()).isEqualTo(first.entryId());
            assertThat(balance()).isEqualTo(6);
        }

        @Test
        @DisplayName("privileged callers are never charged")
        void privileged() {
            ChargeResult result = ledger.charge(AuthenticatedIdentity.admin(USER), 50, "charge:admin", Map.of());

            assertThat(result.charged()).isTrue();
            assertThat(result.privileged()).isTrue();
            assertThat(balance()).isZero();
            assertThat(ledger.findByReference("charge:admin")).isEmpty();
        }

        @Test
        @DisplayName("concurrent charges never overdraw the account")
        void concurrent() throws Exception {
            ledger.allocate(USER, 5, "seed-1", LedgerEntrySource.ADMIN, Map.of());

            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ChargeResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String reference = "charge:concurrent-" + i;
                Callable<ChargeResult> task = () -> {
                    start.await();
                    return ledger.charge(AuthenticatedIdentity.user(USER), 1, reference, Map.of());
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int charged = 0;
            for (Future<ChargeResult> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).charged()) {
                    charged++;
                }
            }
            pool.shutdown();

            assertThat(charged).isEqualTo(5);
            assertThat(balance()).isZero();
            assertThat(integrityService.verifyAccount(USER).balanced()).isTrue();
        }
    }

    @Nested
    @DisplayName("allocate")
    class Allocate {

        @Test
        @DisplayName("a redelivered allocation is absorbed as a duplicate")
        void duplicate() {
            AllocationResult first = ledger.allocate(USER, 50, "pay-1", LedgerEntrySource.PAYMENT, Map.of());
            AllocationResult second = ledger.allocate(USER, 50, "pay-1", LedgerEntrySource.PAYMENT, Map.of());

            assertThat(first.outcome()).isEqualTo(AllocationResult.Outcome.APPLIED);
            assertThat(second.outcome()).isEqualTo(AllocationResult.Outcome.DUPLICATE);
            assertThat(balance()).isEqualTo(50);
        }

        @Test
        @DisplayName("a pending entry completes with its own amount")
        void completesPending() {
            ledger.recordPending(USER, 150, "pay-2", LedgerEntrySource.PAYMENT, Map.of("packageId", "pro"));
            assertThat(balance()).isZero();

            AllocationResult result = ledger.allocate(null, 0, "pay-2", LedgerEntrySource.PAYMENT, Map.of());

            assertThat(result.applied()).isTrue();
            assertThat(result.amount()).isEqualTo(150);
            assertThat(balance()).isEqualTo(150);
            assertThat(ledger.findByReference("pay-2")).get()
                    .extracting(e -> e.status()).isEqualTo(LedgerEntryStatus.COMPLETED);
        }

        @Test
        @DisplayName("an allocation for a failed payment is escalated, not applied")
        void failedEntryConflicts() {
            ledger.recordPending(USER, 50, "pay-3", LedgerEntrySource.PAYMENT, Map.of());
            assertThat(ledger.markFailed("pay-3", "abandoned")).isTrue();

            AllocationResult result = ledger.allocate(USER, 50, "pay-3", LedgerEntrySource.PAYMENT, Map.of());

            assertThat(result.outcome()).isEqualTo(AllocationResult.Outcome.CONFLICT);
            assertThat(balance()).isZero();
            Integer open = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM manual_reconciliations WHERE reference = 'pay-3'", Integer.class);
            assertThat(open).isEqualTo(1);
        }

        @Test
        @DisplayName("markFailed leaves settled entries alone")
        void markFailedSettled() {
            ledger.allocate(USER, 50, "pay-4", LedgerEntrySource.PAYMENT, Map.of());

            assertThat(ledger.markFailed("pay-4", "late failure")).isFalse();
            assertThat(ledger.markFailed("pay-unknown", "no such payment")).isFalse();
            assertThat(balance()).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("refund")
    class Refund {

        @Test
        @DisplayName("restores the charged credits once")
        void refundsOnce() {
            ledger.allocate(USER, 10, "seed-1", LedgerEntrySource.ADMIN, Map.of());
            ledger.charge(AuthenticatedIdentity.user(USER), 4, "charge:adm-1", Map.of());

            RefundResult first = ledger.refund(USER, 4, "adm-1", "operation failed");
            RefundResult second = ledger.refund(USER, 4, "adm-1", "operation failed");

            assertThat(first.outcome()).isEqualTo(RefundResult.Outcome.REFUNDED);
            assertThat(first.balanceAfter()).isEqualTo(10L);
            assertThat(second.outcome()).isEqualTo(RefundResult.Outcome.ALREADY_REFUNDED);
            assertThat(balance()).isEqualTo(10);
            assertThat(integrityService.verifyAccount(USER).balanced()).isTrue();
        }

        @Test
        @DisplayName("leaves exactly a completed charge and a completed refund that cancel out")
        void compensationPair() {
            ledger.allocate(USER, 10, "seed-1", LedgerEntrySource.ADMIN, Map.of());
            ledger.charge(AuthenticatedIdentity.user(USER), 4, "charge:adm-2", Map.of());
            ledger.refund(USER, 4, "adm-2", "operation failed");
            ledger.refund(USER, 4, "adm-2", "operation failed");

            List<LedgerEntryDto> entries = jdbcTemplate.queryForList(
                            "SELECT external_reference FROM ledger_entries WHERE external_reference LIKE ?",
                            String.class, "%adm-2")
                    .stream()
                    .map(reference -> ledger.findByReference(reference).orElseThrow())
                    .sorted(Comparator.comparing(LedgerEntryDto::createdAt)
                            .thenComparing(entry -> entry.kind() == LedgerEntryKind.CHARGE ? 0 : 1))
                    .toList();

            assertThat(entries).hasSize(2);
            LedgerEntryDto charge = entries.get(0);
            LedgerEntryDto refund = entries.get(1);
            assertThat(charge.externalReference()).isEqualTo("charge:adm-2");
            assertThat(charge.kind()).isEqualTo(LedgerEntryKind.CHARGE);
            assertThat(charge.status()).isEqualTo(LedgerEntryStatus.COMPLETED);
            assertThat(charge.amount()).isEqualTo(-4);
            assertThat(refund.externalReference()).isEqualTo("refund:adm-2");
            assertThat(refund.kind()).isEqualTo(LedgerEntryKind.ALLOCATION);
            assertThat(refund.source()).isEqualTo(LedgerEntrySource.REFUND);
            assertThat(refund.status()).isEqualTo(LedgerEntryStatus.COMPLETED);
            assertThat(refund.amount()).isEqualTo(4);
            assertThat(refund.balanceAfter()).isEqualTo(charge.balanceAfter() + 4);
            assertThat(entries.stream().mapToLong(LedgerEntryDto::amount).sum()).isZero();
        }
    }

    @Nested
    @DisplayName("adjust")
    class Adjust {

        @Test
        @DisplayName("positive and negative adjustments are idempotent by key")
        void adjusts() {
            ledger.adjust("admin-1", USER, 20, "goodwill", "key-1");
            ledger.adjust("admin-1", USER, 20, "goodwill", "key-1");
            ledger.adjust("admin-1", USER, -5, "correction", "key-2");

            assertThat(balance()).isEqualTo(15);
        }

        @Test
        @DisplayName("a negative adjustment may not overdraw")
        void noOverdraw() {
            ledger.adjust("admin-1", USER, 3, "goodwill", "key-1");

            assertThatThrownBy(() -> ledger.adjust("admin-1", USER, -5, "correction", "key-2"))
                    .isInstanceOf(InsufficientCreditsException.class);
            assertThat(balance()).isEqualTo(3);
        }

        @Test
        @DisplayName("reusing a key for a different adjustment is a conflict")
        void keyReuse() {
            ledger.adjust("admin-1", USER, 3, "goodwill", "key-1");

            assertThatThrownBy(() -> ledger.adjust("admin-1", USER, 7, "goodwill", "key-1"))
                    .isInstanceOf(LedgerReferenceConflictException.class);
        }
    }
}
