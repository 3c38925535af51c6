package uk.gegc.eventpay.features.webhook.application;

import uk.gegc.eventpay.features.webhook.application.verification.WebhookRequest;

/**
 * Verify, deduplicate, classify and apply one webhook delivery.
 */
public interface WebhookProcessingService {

    enum Result {
        OK,
        DUPLICATE,
        IGNORED
    }

    /**
     * @throws uk.gegc.eventpay.features.webhook.domain.exception.WebhookSignatureException when verification fails
     * @throws uk.gegc.eventpay.features.webhook.domain.exception.WebhookVerificationUnavailableException when
     *         verification is required but not configured
     * @throws uk.gegc.eventpay.features.webhook.domain.exception.MalformedWebhookPayloadException when the body is
     *         not an event
     */
    WebhookReceipt process(WebhookRequest request, String requestId);
}
