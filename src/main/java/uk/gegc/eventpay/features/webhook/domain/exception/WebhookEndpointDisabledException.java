package uk.gegc.eventpay.features.webhook.domain.exception;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

public class WebhookEndpointDisabledException extends RuntimeException {

    private final WebhookProvider provider;

    public WebhookEndpointDisabledException(WebhookProvider provider) {
        super("Webhook endpoint for " + provider.slug() + " is disabled");
        this.provider = provider;
    }

    public WebhookProvider getProvider() {
        return provider;
    }
}
