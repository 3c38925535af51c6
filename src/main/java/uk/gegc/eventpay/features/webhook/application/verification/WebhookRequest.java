package uk.gegc.eventpay.features.webhook.application.verification;

import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raw delivery as received: the body must stay byte-for-byte intact for HMAC checks.
 * Header names are stored lower-cased.
 */
public record WebhookRequest(WebhookProvider provider, String payload, Map<String, String> headers) {

    public WebhookRequest {
        payload = payload == null ? "" : payload;
        headers = headers == null ? Map.of() : headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue,
                        (first, second) -> first));
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
