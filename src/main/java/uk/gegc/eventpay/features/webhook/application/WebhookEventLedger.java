package uk.gegc.eventpay.features.webhook.application;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Record of provider events already handled, keyed by provider and provider event id.
 */
public interface WebhookEventLedger {

    boolean isProcessed(WebhookProvider provider, String eventId);

    /**
     * Records the event inside the caller's transaction, so the record commits or rolls back
     * together with the state change it proves.
     *
     * @return {@code false} when the event was already recorded
     */
    boolean markProcessed(WebhookProvider provider, String eventId, String eventType, String linkedOrderId);
}
