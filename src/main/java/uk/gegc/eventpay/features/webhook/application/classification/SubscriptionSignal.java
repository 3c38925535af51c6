package uk.gegc.eventpay.features.webhook.application.classification;

/**
 * Which provider notification a subscription lifecycle intent came from.
 */
public enum SubscriptionSignal {
    /** Subscription created or updated; the provider status says what it is now. */
    STATUS_CHANGED,
    /** Subscription ended at the provider. */
    DELETED,
    INVOICE_PAYMENT_FAILED,
    INVOICE_PAID
}
