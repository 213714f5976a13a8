package uk.gegc.imagestudio.features.ledger.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "BalanceDto", description = "User's credit balance")
public record BalanceDto(
        @Schema(description = "User identifier")
        String userId,

        @Schema(description = "Credits available", example = "120")
        long balance,

        @Schema(description = "Last balance change; null when the account was never used")
        Instant updatedAt
) {}
