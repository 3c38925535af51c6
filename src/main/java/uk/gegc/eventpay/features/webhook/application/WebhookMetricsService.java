package uk.gegc.eventpay.features.webhook.application;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Service for emitting webhook processing metrics.
 */
public interface WebhookMetricsService {

    void incrementReceived(WebhookProvider provider, String eventType);

    void incrementOk(WebhookProvider provider, String eventType);

    void incrementDuplicate(WebhookProvider provider, String eventType);

    void incrementIgnored(WebhookProvider provider, String eventType);

    /**
     * Delivery refused before processing: bad signature, unconfigured verification or malformed body.
     */
    void incrementRejected(WebhookProvider provider, String reason);

    void incrementFailed(WebhookProvider provider, String eventType);

    void recordLatency(WebhookProvider provider, String eventType, long latencyMs);
}
