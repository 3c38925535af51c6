package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only platform debt ledger entry written when a digital ticket payment settles debt.
 */
@Entity
@Table(name = "platform_debt_settlements",
        uniqueConstraints = @UniqueConstraint(name = "uk_platform_debt_settlement_order", columnNames = "order_id"),
        indexes = @Index(name = "idx_platform_debt_settlement_organizer", columnList = "organizer_id"))
@Getter
@NoArgsConstructor
public class PlatformDebtSettlement {

    public static final String DIGITAL_SETTLEMENT = "DIGITAL_SETTLEMENT";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organizer_id", nullable = false, updatable = false, length = 64)
    private String organizerId;

    @Column(name = "transaction_type", nullable = false, updatable = false, length = 32)
    private String transactionType;

    @Column(name = "order_id", nullable = false, updatable = false, length = 64)
    private String orderId;

    @Column(name = "event_id", updatable = false, length = 64)
    private String eventId;

    @Column(name = "amount_cents", nullable = false, updatable = false)
    private long amountCents;

    @Column(name = "balance_after_cents", nullable = false, updatable = false)
    private long balanceAfterCents;

    @Column(name = "description", updatable = false)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public PlatformDebtSettlement(String organizerId, String orderId, String eventId, long amountCents,
                                  long balanceAfterCents, LocalDateTime createdAt) {
        this.organizerId = organizerId;
        this.transactionType = DIGITAL_SETTLEMENT;
        this.orderId = orderId;
        this.eventId = eventId;
        this.amountCents = amountCents;
        this.balanceAfterCents = balanceAfterCents;
        this.description = "Settlement from digital payment";
        this.createdAt = createdAt;
    }
}
