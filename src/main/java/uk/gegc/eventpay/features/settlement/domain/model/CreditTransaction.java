package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A credit purchase. The checkout may create it as PENDING; the payment webhook completes it.
 */
@Entity
@Table(name = "credit_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_credit_transactions_payment", columnNames = "payment_reference"))
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organizer_id", nullable = false, length = 64)
    private String organizerId;

    /** Stripe payment intent or PayPal capture id. */
    @Column(name = "payment_reference", nullable = false)
    private String paymentReference;

    @Column(name = "tickets_purchased", nullable = false)
    private int ticketsPurchased;

    @Column(name = "amount_paid_cents", nullable = false)
    private long amountPaidCents;

    @Column(name = "price_per_ticket_cents", nullable = false)
    private long pricePerTicketCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CreditTransactionStatus status = CreditTransactionStatus.PENDING;

    @Column(name = "purchased_at", nullable = false)
    private LocalDateTime purchasedAt;
}
