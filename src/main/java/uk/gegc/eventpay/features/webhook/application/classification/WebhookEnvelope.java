package uk.gegc.eventpay.features.webhook.application.classification;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parsed delivery: the provider's event id and type plus the full JSON body.
 */
public record WebhookEnvelope(String eventId, String eventType, JsonNode body) {
}
