package uk.gegc.imagestudio.features.payment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A recurring Paystack plan, keyed by the gateway's subscription code.
 */
@Entity
@Table(name = "subscriptions",
        uniqueConstraints = @UniqueConstraint(name = "uk_subscription_code", columnNames = "subscription_code"),
        indexes = @Index(name = "idx_subscription_user", columnList = "user_id"))
@Getter
@Setter
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "subscription_code", nullable = false, updatable = false, length = 128)
    private String subscriptionCode;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(name = "plan_id", length = 128)
    private String planId;

    @Column(name = "customer_email", length = 320)
    private String customerEmail;

    @Column(name = "email_token", length = 128)
    private String emailToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SubscriptionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    public void activate(Instant now) {
        this.status = SubscriptionStatus.ACTIVE;
        this.cancelledAt = null;
        this.updatedAt = now;
    }

    public void cancel(Instant now) {
        this.status = SubscriptionStatus.CANCELLED;
        this.cancelledAt = now;
        this.updatedAt = now;
    }
}
