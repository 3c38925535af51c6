package uk.gegc.eventpay.features.webhook.application;

import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Dispatches a classified intent to the state machine or reconciler that owns it. Runs inside
 * the caller's transaction.
 */
public interface WebhookIntentRouter {

    RoutingOutcome route(WebhookProvider provider, WebhookIntent intent, WebhookLoggingContext context);
}
