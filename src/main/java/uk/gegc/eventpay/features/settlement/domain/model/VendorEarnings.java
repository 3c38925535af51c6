package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only earnings line, one per product order.
 */
@Entity
@Table(name = "vendor_earnings",
        uniqueConstraints = @UniqueConstraint(name = "uk_vendor_earnings_order", columnNames = "product_order_id"),
        indexes = @Index(name = "idx_vendor_earnings_vendor", columnList = "vendor_id"))
@Getter
@NoArgsConstructor
public class VendorEarnings {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private UUID vendorId;

    @Column(name = "product_order_id", nullable = false, updatable = false)
    private UUID productOrderId;

    @Column(name = "order_number", updatable = false, length = 64)
    private String orderNumber;

    @Column(name = "gross_amount_cents", nullable = false, updatable = false)
    private long grossAmountCents;

    @Column(name = "commission_rate", nullable = false, updatable = false)
    private int commissionRate;

    @Column(name = "commission_cents", nullable = false, updatable = false)
    private long commissionCents;

    @Column(name = "net_amount_cents", nullable = false, updatable = false)
    private long netAmountCents;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public VendorEarnings(UUID vendorId, UUID productOrderId, String orderNumber, long grossAmountCents,
                          int commissionRate, long commissionCents, LocalDateTime createdAt) {
        this.vendorId = vendorId;
        this.productOrderId = productOrderId;
        this.orderNumber = orderNumber;
        this.grossAmountCents = grossAmountCents;
        this.commissionRate = commissionRate;
        this.commissionCents = commissionCents;
        this.netAmountCents = grossAmountCents - commissionCents;
        this.createdAt = createdAt;
    }
}
