package uk.gegc.eventpay.features.webhook.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-delivery log fields. Each log call puts the non-null fields into the MDC for the duration
 * of that one statement, so a context can be narrowed (order, subscription, dispute) without
 * leaking fields into unrelated log lines on the same thread.
 */
@Data
@Builder(toBuilder = true)
public class WebhookLoggingContext {

    static final List<String> MDC_KEYS = List.of(
            "request_id", "webhook_provider", "webhook_event_id", "webhook_event_type",
            "order_id", "subscription_id", "dispute_id");

    private String requestId;
    private WebhookProvider provider;
    private String eventId;
    private String eventType;
    private String orderId;
    private String subscriptionId;
    private String disputeId;

    Map<String, String> fields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("request_id", requestId);
        fields.put("webhook_provider", provider != null ? provider.slug() : null);
        fields.put("webhook_event_id", eventId);
        fields.put("webhook_event_type", eventType);
        fields.put("order_id", orderId);
        fields.put("subscription_id", subscriptionId);
        fields.put("dispute_id", disputeId);
        return fields;
    }

    public static void clearMDC() {
        MDC_KEYS.forEach(MDC::remove);
    }

    public WebhookLoggingContext withOrderId(String orderId) {
        return toBuilder().orderId(orderId).build();
    }

    public WebhookLoggingContext withSubscriptionId(String subscriptionId) {
        return toBuilder().subscriptionId(subscriptionId).build();
    }

    public WebhookLoggingContext withDisputeId(String disputeId) {
        return toBuilder().disputeId(disputeId).build();
    }

    public void logInfo(Logger logger, String message, Object... args) {
        withFields(() -> logger.info(message, args));
    }

    public void logWarn(Logger logger, String message, Object... args) {
        withFields(() -> logger.warn(message, args));
    }

    /** The throwable, if any, goes last in {@code args}, as SLF4J expects. */
    public void logError(Logger logger, String message, Object... args) {
        withFields(() -> logger.error(message, args));
    }

    private void withFields(Runnable logStatement) {
        fields().forEach((key, value) -> {
            if (value != null) {
                MDC.put(key, value);
            }
        });
        try {
            logStatement.run();
        } finally {
            clearMDC();
        }
    }
}
