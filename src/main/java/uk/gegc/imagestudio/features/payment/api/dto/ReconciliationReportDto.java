package uk.gegc.imagestudio.features.payment.api.dto;

import java.util.List;

public record ReconciliationReportDto(
        int examined,
        int reconciledCount,
        int failedCount,
        int skipped,
        List<String> errors
) {}
