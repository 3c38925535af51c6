package uk.gegc.eventpay.features.webhook.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ledger row proving a provider event was fully handled. Rows are written once and never
 * updated or deleted; provider event ids are only unique within a provider.
 */
@Entity
@Table(name = "processed_webhook_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_processed_webhook_provider_event",
                columnNames = {"provider", "provider_event_id"}))
@Getter
@NoArgsConstructor
public class ProcessedWebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, updatable = false, length = 16)
    private WebhookProvider provider;

    @Column(name = "provider_event_id", nullable = false, updatable = false, length = 255)
    private String providerEventId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 128)
    private String eventType;

    @Column(name = "linked_order_id", updatable = false, length = 64)
    private String linkedOrderId;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private LocalDateTime processedAt;

    public ProcessedWebhookEvent(WebhookProvider provider,
                                 String providerEventId,
                                 String eventType,
                                 String linkedOrderId,
                                 LocalDateTime processedAt) {
        this.provider = provider;
        this.providerEventId = providerEventId;
        this.eventType = eventType;
        this.linkedOrderId = linkedOrderId;
        this.processedAt = processedAt;
    }
}
