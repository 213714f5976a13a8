package uk.gegc.imagestudio.features.payment.application;

import java.util.List;

/**
 * Outcome of one reconciliation sweep over pending payments.
 *
 * @param examined        pending entries looked at
 * @param reconciledCount entries completed because the gateway reported success
 * @param failedCount     entries marked failed because the gateway reported a terminal failure
 * @param skipped         entries left pending (still in progress at the gateway, or already settled)
 * @param errors          one line per entry that could not be checked
 */
public record ReconciliationReport(int examined, int reconciledCount, int failedCount, int skipped,
                                   List<String> errors) {
}
