package uk.gegc.eventpay.features.settlement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "food_orders")
@Getter
@Setter
public class FoodOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "order_number", nullable = false, length = 64)
    private String orderNumber;

    @Column(name = "restaurant_id", length = 64)
    private String restaurantId;

    @Column(name = "total_cents", nullable = false)
    private long totalCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 16)
    private MerchandisePaymentStatus paymentStatus = MerchandisePaymentStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_provider", length = 16)
    private WebhookProvider paymentProvider;

    @Column(name = "provider_payment_id")
    private String providerPaymentId;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
