package uk.gegc.imagestudio.features.ledger.api.dto;

import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryKind;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntrySource;
import uk.gegc.imagestudio.features.ledger.domain.model.LedgerEntryStatus;

import java.time.Instant;
import java.util.UUID;

public record LedgerEntryDto(
        UUID id,
        String userId,
        LedgerEntryKind kind,
        LedgerEntrySource source,
        long amount,
        String externalReference,
        LedgerEntryStatus status,
        String metaJson,
        Long balanceAfter,
        String failureReason,
        Instant createdAt,
        Instant completedAt
) {}
