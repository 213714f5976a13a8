package uk.gegc.imagestudio.features.ledger.api.dto;

import java.util.UUID;

public record AdjustmentResultDto(
        String userId,
        long amount,
        UUID entryId,
        Long balanceAfter,
        boolean duplicate
) {}
