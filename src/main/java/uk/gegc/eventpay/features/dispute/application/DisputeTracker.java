package uk.gegc.eventpay.features.dispute.application;

import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

public interface DisputeTracker {

    /**
     * Records a new dispute. A dispute id already on file is left untouched and reported
     * with {@code alreadyExists = true}.
     */
    DisputeOpenResult open(WebhookProvider provider, WebhookIntent.DisputeOpened dispute);

    /**
     * Closes an open dispute. Resolving a dispute twice is a no-op.
     */
    DisputeResolution resolve(String disputeId, String outcomeCode, String outcomeReason);
}
