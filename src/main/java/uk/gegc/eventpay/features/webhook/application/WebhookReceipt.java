package uk.gegc.eventpay.features.webhook.application;

/**
 * What the endpoint acknowledges back to the provider.
 */
public record WebhookReceipt(WebhookProcessingService.Result result, String requestId, String eventId, String eventType) {

    public boolean isDuplicate() {
        return result == WebhookProcessingService.Result.DUPLICATE;
    }
}
