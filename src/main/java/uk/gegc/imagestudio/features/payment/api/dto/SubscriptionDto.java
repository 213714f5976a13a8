package uk.gegc.imagestudio.features.payment.api.dto;

import uk.gegc.imagestudio.features.payment.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.UUID;

public record SubscriptionDto(
        UUID id,
        String subscriptionCode,
        String userId,
        String planId,
        SubscriptionStatus status,
        Instant createdAt,
        Instant updatedAt,
        Instant cancelledAt
) {}
