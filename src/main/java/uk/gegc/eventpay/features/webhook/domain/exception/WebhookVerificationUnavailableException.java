package uk.gegc.eventpay.features.webhook.domain.exception;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Thrown in production when a provider's verification credentials are not configured.
 * Deliveries are refused (403) rather than processed unverified.
 */
public class WebhookVerificationUnavailableException extends RuntimeException {

    private final WebhookProvider provider;

    public WebhookVerificationUnavailableException(WebhookProvider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public WebhookProvider getProvider() {
        return provider;
    }
}
