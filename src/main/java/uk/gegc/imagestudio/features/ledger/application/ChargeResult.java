package uk.gegc.imagestudio.features.ledger.application;

import java.util.UUID;

/**
 * @param charged      false only when the balance did not cover the amount
 * @param privileged   true when the charge was waived for a privileged caller
 * @param balanceAfter balance after the charge; the unchanged balance when refused; null when waived
 * @param entryId      the CHARGE entry; null when refused or waived
 * @param required     the amount asked for
 */
public record ChargeResult(
        boolean charged,
        boolean privileged,
        Long balanceAfter,
        UUID entryId,
        long required
) {

    public static ChargeResult waived(long required) {
        return new ChargeResult(true, true, null, null, required);
    }

    public static ChargeResult charged(long balanceAfter, UUID entryId, long required) {
        return new ChargeResult(true, false, balanceAfter, entryId, required);
    }

    public static ChargeResult insufficient(long balance, long required) {
        return new ChargeResult(false, false, balance, null, required);
    }
}
