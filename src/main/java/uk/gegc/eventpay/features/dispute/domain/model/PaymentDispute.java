package uk.gegc.eventpay.features.dispute.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "payment_disputes", indexes = {
        @Index(name = "idx_payment_disputes_order", columnList = "order_id")
})
@Getter
@Setter
public class PaymentDispute {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "dispute_id", nullable = false, unique = true)
    private String disputeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 16)
    private WebhookProvider provider;

    @Column(name = "order_id")
    private UUID orderId;

    @Column(name = "transaction_id")
    private String transactionId;

    @Column(name = "stripe_payment_intent_id")
    private String stripePaymentIntentId;

    @Column(name = "paypal_order_id")
    private String paypalOrderId;

    @Column(name = "reason")
    private String reason;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "buyer_email")
    private String buyerEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private DisputeStatus status = DisputeStatus.OPEN;

    @Column(name = "outcome_code", length = 64)
    private String outcomeCode;

    @Column(name = "outcome_reason")
    private String outcomeReason;

    @Column(name = "response_deadline")
    private LocalDateTime responseDeadline;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
