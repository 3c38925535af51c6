package uk.gegc.eventpay.features.settlement.application;

import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Applies a successful payment to whatever it paid for: a ticket order, a marketplace or food
 * order, or a platform product. Enrichment (debt settlement, vendor earnings and stats) runs in
 * separate transactions and never fails the primary update.
 */
public interface SettlementReconciler {

    SettlementResult reconcile(WebhookProvider provider, WebhookIntent.PaymentSucceeded payment);
}
