package uk.gegc.eventpay.features.webhook.domain.model;

/**
 * Payment providers that deliver webhooks to this service.
 */
public enum WebhookProvider {
    STRIPE("stripe"),
    PAYPAL("paypal");

    private final String slug;

    WebhookProvider(String slug) {
        this.slug = slug;
    }

    /** Lower-case name used in request ids, log fields and metric tags. */
    public String slug() {
        return slug;
    }
}
