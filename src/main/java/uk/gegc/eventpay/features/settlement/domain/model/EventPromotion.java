package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Paid, time-boxed visibility boost for an event.
 */
@Entity
@Table(name = "event_promotions", indexes = {
        @Index(name = "idx_event_promotions_event", columnList = "event_id"),
        @Index(name = "idx_event_promotions_payment", columnList = "payment_reference")
})
@Getter
@Setter
public class EventPromotion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false, length = 64)
    private String eventId;

    @Column(name = "organizer_id", length = 64)
    private String organizerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "promotion_type", nullable = false, length = 32)
    private PromotionType promotionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PromotionStatus status = PromotionStatus.PENDING;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "amount_paid_cents", nullable = false)
    private long amountPaidCents;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
