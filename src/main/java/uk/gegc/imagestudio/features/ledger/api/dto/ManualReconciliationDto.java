package uk.gegc.imagestudio.features.ledger.api.dto;

import uk.gegc.imagestudio.features.ledger.domain.model.ManualReconciliationStatus;

import java.time.Instant;
import java.util.UUID;

public record ManualReconciliationDto(
        UUID id,
        String userId,
        long amount,
        String reference,
        String reason,
        ManualReconciliationStatus status,
        String resolvedBy,
        String resolutionNote,
        Instant createdAt,
        Instant resolvedAt
) {}
