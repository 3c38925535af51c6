package uk.gegc.eventpay.features.webhook.domain.exception;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Thrown when a webhook delivery fails authenticity verification. Stripe rejections map to
 * 400 and PayPal rejections to 401, matching what each provider expects back.
 */
public class WebhookSignatureException extends RuntimeException {

    private final WebhookProvider provider;

    public WebhookSignatureException(WebhookProvider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public WebhookProvider getProvider() {
        return provider;
    }
}
