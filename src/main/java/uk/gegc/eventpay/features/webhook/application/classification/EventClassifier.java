package uk.gegc.eventpay.features.webhook.application.classification;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Pure mapping from one provider's event JSON to a {@link WebhookIntent}. No I/O and no store
 * access; unknown or unusable events come back as {@link WebhookIntent.Ignored}.
 */
public interface EventClassifier {

    WebhookProvider provider();

    /**
     * Reads the event id and type. Either may be {@code null} when the body lacks them.
     */
    WebhookEnvelope envelope(JsonNode body);

    WebhookIntent classify(WebhookEnvelope envelope);
}
