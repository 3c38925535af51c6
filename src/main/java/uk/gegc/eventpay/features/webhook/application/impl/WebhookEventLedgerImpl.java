package uk.gegc.eventpay.features.webhook.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.eventpay.features.webhook.application.WebhookEventLedger;
import uk.gegc.eventpay.features.webhook.domain.model.ProcessedWebhookEvent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.features.webhook.infra.repository.ProcessedWebhookEventRepository;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventLedgerImpl implements WebhookEventLedger {

    private final ProcessedWebhookEventRepository repository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public boolean isProcessed(WebhookProvider provider, String eventId) {
        return repository.existsByProviderAndProviderEventId(provider, eventId);
    }

    @Override
    @Transactional
    public boolean markProcessed(WebhookProvider provider, String eventId, String eventType, String linkedOrderId) {
        if (repository.existsByProviderAndProviderEventId(provider, eventId)) {
            log.info("{} event {} already recorded as processed", provider.slug(), eventId);
            return false;
        }
        // Flush so a concurrent twin fails on the unique key here, inside the business transaction
        repository.saveAndFlush(new ProcessedWebhookEvent(
                provider, eventId, eventType, linkedOrderId, LocalDateTime.now(clock)));
        return true;
    }
}
