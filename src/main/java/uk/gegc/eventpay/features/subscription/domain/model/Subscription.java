package uk.gegc.eventpay.features.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Organizer subscription. Never deleted: cancellation is a status.
 */
@Entity
@Table(name = "subscriptions", indexes = {
        @Index(name = "idx_subscriptions_user", columnList = "user_id")
})
@Data
@NoArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan", nullable = false, length = 32)
    private SubscriptionPlan plan;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SubscriptionState status;

    /** Last status string reported by the provider, kept for support. */
    @Column(name = "provider_status", length = 64)
    private String providerStatus;

    @Column(name = "stripe_subscription_id", unique = true)
    private String stripeSubscriptionId;

    @Column(name = "stripe_customer_id")
    private String stripeCustomerId;

    @Column(name = "stripe_price_id")
    private String stripePriceId;

    @Column(name = "max_events_per_month")
    private Integer maxEventsPerMonth;

    @Column(name = "max_tickets_per_event")
    private Integer maxTicketsPerEvent;

    @Column(name = "included_credits", nullable = false)
    private int includedCredits;

    @Column(name = "attempt_count")
    private Integer attemptCount;

    @Column(name = "last_payment_amount_cents")
    private Long lastPaymentAmountCents;

    @Column(name = "last_payment_at")
    private LocalDateTime lastPaymentAt;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void applyPlan(SubscriptionPlan plan) {
        this.plan = plan;
        this.maxEventsPerMonth = plan.getMaxEventsPerMonth();
        this.maxTicketsPerEvent = plan.getMaxTicketsPerEvent();
        this.includedCredits = plan.getIncludedCredits();
    }
}
