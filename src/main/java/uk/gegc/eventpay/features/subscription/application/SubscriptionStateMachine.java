package uk.gegc.eventpay.features.subscription.application;

import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;

/**
 * Drives organizer subscriptions through ACTIVE, PAST_DUE and CANCELLED.
 * Cancellation is terminal for a provider subscription id.
 */
public interface SubscriptionStateMachine {

    /**
     * Applies a provider lifecycle event: status changes, deletions and invoice outcomes.
     */
    SubscriptionTransitionResult handleLifecycle(WebhookIntent.SubscriptionLifecycle lifecycle);

    /**
     * Creates the user's subscription, or moves the existing one to the given plan.
     */
    SubscriptionTransitionResult activate(SubscriptionActivation activation);

    SubscriptionTransitionResult markPastDue(String stripeSubscriptionId, Integer attemptCount, String providerStatus);

    SubscriptionTransitionResult cancel(String stripeSubscriptionId, String providerStatus);

    SubscriptionTransitionResult renew(String stripeSubscriptionId, Long amountPaidCents);
}
