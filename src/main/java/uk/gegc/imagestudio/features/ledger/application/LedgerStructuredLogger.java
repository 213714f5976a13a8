package uk.gegc.imagestudio.features.ledger.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs ledger writes with their key fields in the MDC so they can be indexed.
 */
public final class LedgerStructuredLogger {

    private LedgerStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String level, String message,
            String userId, String kind, String source, long amount,
            String reference, Long balanceAfter, Object... additionalArgs) {

        MDC.put("ledger.userId", userId);
        MDC.put("ledger.kind", kind);
        MDC.put("ledger.source", source);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.reference", reference);
        MDC.put("ledger.balanceAfter", balanceAfter != null ? String.valueOf(balanceAfter) : null);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void logManualReconciliation(Logger logger, String message,
            String userId, long amount, String reference, String reason, Object... additionalArgs) {

        MDC.put("ledger.userId", userId);
        MDC.put("ledger.amount", String.valueOf(amount));
        MDC.put("ledger.reference", reference);
        MDC.put("ledger.manualReason", reason);

        try {
            logger.error(message, additionalArgs);
        } finally {
            clearLedgerMDC();
        }
    }

    public static void clearLedgerMDC() {
        MDC.remove("ledger.userId");
        MDC.remove("ledger.kind");
        MDC.remove("ledger.source");
        MDC.remove("ledger.amount");
        MDC.remove("ledger.reference");
        MDC.remove("ledger.balanceAfter");
        MDC.remove("ledger.manualReason");
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }
}
