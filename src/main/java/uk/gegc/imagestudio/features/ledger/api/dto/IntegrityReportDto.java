package uk.gegc.imagestudio.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "IntegrityReportDto", description = "Stored balance compared with the sum of completed entries")
public record IntegrityReportDto(
        String userId,
        boolean balanced,
        long calculatedBalance,
        long actualBalance,
        long driftAmount,
        String details
) {}
