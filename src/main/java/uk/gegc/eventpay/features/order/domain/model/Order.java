package uk.gegc.eventpay.features.order.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Ticket order. Created by checkout (outside this service); webhooks only move its payment
 * status and record provider correlation ids.
 */
@Entity(name = "TicketOrder")
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_stripe_payment_intent", columnList = "stripe_payment_intent_id"),
        @Index(name = "idx_orders_paypal_order", columnList = "paypal_order_id"),
        @Index(name = "idx_orders_paypal_capture", columnList = "paypal_capture_id")
})
@Getter
@Setter
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "order_number", length = 64)
    private String orderNumber;

    @Column(name = "event_id", length = 64)
    private String eventId;

    @Column(name = "event_name")
    private String eventName;

    @Column(name = "buyer_email")
    private String buyerEmail;

    @Column(name = "buyer_name")
    private String buyerName;

    @Column(name = "ticket_count", nullable = false)
    private int ticketCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OrderStatus status = OrderStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 32)
    private PaymentMethod paymentMethod;

    @Column(name = "subtotal_cents", nullable = false)
    private long subtotalCents;

    @Column(name = "fees_cents", nullable = false)
    private long feesCents;

    @Column(name = "total_cents", nullable = false)
    private long totalCents;

    @Column(name = "stripe_payment_intent_id")
    private String stripePaymentIntentId;

    @Column(name = "paypal_order_id")
    private String paypalOrderId;

    @Column(name = "paypal_capture_id")
    private String paypalCaptureId;

    @Column(name = "failure_reason", length = 512)
    private String failureReason;

    @Column(name = "refunded_amount_cents")
    private Long refundedAmountCents;

    @Column(name = "refund_reason", length = 512)
    private String refundReason;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
