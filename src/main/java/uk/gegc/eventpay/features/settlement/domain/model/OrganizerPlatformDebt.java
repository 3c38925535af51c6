package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Running balance of fees an organizer owes the platform from cash sales.
 */
@Entity
@Table(name = "organizer_platform_debt")
@Getter
@Setter
public class OrganizerPlatformDebt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "organizer_id", nullable = false, unique = true, length = 64)
    private String organizerId;

    @Column(name = "total_debt_cents", nullable = false)
    private long totalDebtCents;

    @Column(name = "total_settled_cents", nullable = false)
    private long totalSettledCents;

    @Column(name = "remaining_debt_cents", nullable = false)
    private long remainingDebtCents;

    @Column(name = "last_settlement_at")
    private LocalDateTime lastSettlementAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Applies a settlement payment; the remaining balance never goes below zero.
     *
     * @return remaining debt after the settlement
     */
    public long settle(long amountCents, LocalDateTime at) {
        totalSettledCents += amountCents;
        remainingDebtCents = Math.max(0, remainingDebtCents - amountCents);
        lastSettlementAt = at;
        updatedAt = at;
        return remainingDebtCents;
    }
}
