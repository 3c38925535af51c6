package uk.gegc.eventpay.features.webhook.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.eventpay.features.webhook.domain.model.ProcessedWebhookEvent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.util.Optional;

public interface ProcessedWebhookEventRepository extends JpaRepository<ProcessedWebhookEvent, Long> {

    boolean existsByProviderAndProviderEventId(WebhookProvider provider, String providerEventId);

    Optional<ProcessedWebhookEvent> findByProviderAndProviderEventId(WebhookProvider provider, String providerEventId);

    long countByProviderAndProviderEventId(WebhookProvider provider, String providerEventId);
}
