package uk.gegc.eventpay.features.webhook.application.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.at;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.first;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.text;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.toStringMap;

/**
 * Maps PayPal notification events. Our own correlation data travels in the JSON-encoded
 * {@code custom_id} set when the PayPal order was created.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayPalEventClassifier implements EventClassifier {

    private final ObjectMapper objectMapper;

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.PAYPAL;
    }

    @Override
    public WebhookEnvelope envelope(JsonNode body) {
        return new WebhookEnvelope(text(body, "id"), text(body, "event_type"), body);
    }

    @Override
    public WebhookIntent classify(WebhookEnvelope envelope) {
        String type = envelope.eventType() == null ? "" : envelope.eventType();
        JsonNode resource = envelope.body().path("resource");
        if (!resource.isObject()) {
            return new WebhookIntent.Ignored("PayPal event " + type + " has no resource");
        }

        return switch (type) {
            case "PAYMENT.CAPTURE.COMPLETED", "PAYMENT.SALE.COMPLETED" -> paymentCompleted(resource);
            case "PAYMENT.CAPTURE.DENIED" -> new WebhookIntent.PaymentFailed(
                    captureCorrelation(resource, customData(text(resource, "custom_id"))),
                    "PayPal payment capture denied");
            case "PAYMENT.CAPTURE.REFUNDED" -> paymentRefunded(resource);
            case "CHECKOUT.ORDER.APPROVED" -> checkoutApproved(resource);
            case "CUSTOMER.DISPUTE.CREATED" -> disputeCreated(resource);
            case "CUSTOMER.DISPUTE.RESOLVED" -> disputeResolved(resource);
            default -> new WebhookIntent.Ignored("Unhandled PayPal event type: " + type);
        };
    }

    private WebhookIntent paymentCompleted(JsonNode resource) {
        Map<String, String> custom = customData(text(resource, "custom_id"));
        PaymentPurpose purpose;
        try {
            purpose = PaymentPurposeDecoder.decode(custom);
        } catch (UnknownPaymentPurposeException e) {
            log.warn("PayPal payment with unrecognised purpose ignored: {}", e.getMessage());
            return new WebhookIntent.Ignored(e.getMessage());
        }
        String currency = currency(resource.path("amount"));
        // Captures carry amount.value, legacy sales carry amount.total
        String value = at(resource, "amount", "value");
        if (value == null) {
            value = at(resource, "amount", "total");
        }
        return new WebhookIntent.PaymentSucceeded(
                captureCorrelation(resource, custom),
                MinorUnits.fromDecimal(value, currency),
                currency,
                purpose);
    }

    private WebhookIntent paymentRefunded(JsonNode refund) {
        Map<String, String> custom = customData(text(refund, "custom_id"));
        // The resource is the refund; the capture it reverses is in related_ids or the "up" link
        String captureId = at(refund, "supplementary_data", "related_ids", "capture_id");
        if (captureId == null) {
            captureId = captureIdFromLinks(refund.path("links"));
        }
        String paypalOrderId = custom.get("paypalOrderId");
        if (paypalOrderId == null) {
            paypalOrderId = at(refund, "supplementary_data", "related_ids", "order_id");
        }
        String currency = currency(refund.path("amount"));
        return new WebhookIntent.PaymentRefunded(
                PaymentCorrelation.paypal(custom.get("orderId"), paypalOrderId, captureId),
                MinorUnits.fromDecimal(at(refund, "amount", "value"), currency),
                "PayPal refund processed");
    }

    private WebhookIntent checkoutApproved(JsonNode order) {
        JsonNode purchaseUnit = first(order.path("purchase_units"));
        Map<String, String> custom = customData(text(purchaseUnit, "custom_id"));
        return new WebhookIntent.CheckoutApproved(
                PaymentCorrelation.paypal(custom.get("orderId"), text(order, "id"), null));
    }

    private WebhookIntent disputeCreated(JsonNode dispute) {
        String disputeId = disputeId(dispute);
        if (disputeId == null) {
            log.error("PayPal dispute created without a dispute id");
            return new WebhookIntent.Ignored("Dispute created event without dispute id");
        }
        JsonNode transaction = first(dispute.path("disputed_transactions"));
        Map<String, String> custom = customData(text(transaction, "custom"));
        String currency = at(dispute, "dispute_amount", "currency_code");
        if (currency == null) {
            currency = "USD";
        }
        String reason = text(dispute, "reason");
        return new WebhookIntent.DisputeOpened(
                disputeId,
                MinorUnits.fromDecimal(at(dispute, "dispute_amount", "value"), currency),
                currency,
                reason != null ? reason : "unknown",
                PaymentCorrelation.paypal(custom.get("orderId"), custom.get("paypalOrderId"), null),
                text(transaction, "seller_transaction_id"),
                at(transaction, "buyer", "email"),
                parseTimestamp(text(dispute, "seller_response_due_date")));
    }

    private WebhookIntent disputeResolved(JsonNode dispute) {
        String disputeId = disputeId(dispute);
        if (disputeId == null) {
            log.error("PayPal dispute resolved without a dispute id");
            return new WebhookIntent.Ignored("Dispute resolved event without dispute id");
        }
        String outcomeCode = at(dispute, "dispute_outcome", "outcome_code");
        return new WebhookIntent.DisputeResolved(
                disputeId,
                outcomeCode != null ? outcomeCode : "unknown",
                at(dispute, "dispute_outcome", "outcome_reason"));
    }

    private PaymentCorrelation captureCorrelation(JsonNode capture, Map<String, String> custom) {
        String paypalOrderId = custom.get("paypalOrderId");
        if (paypalOrderId == null) {
            paypalOrderId = at(capture, "supplementary_data", "related_ids", "order_id");
        }
        return PaymentCorrelation.paypal(custom.get("orderId"), paypalOrderId, text(capture, "id"));
    }

    /**
     * {@code custom_id} is free text to PayPal. Anything that is not a JSON object yields an empty map.
     */
    Map<String, String> customData(String customId) {
        if (customId == null || customId.isBlank()) {
            return Map.of();
        }
        try {
            return toStringMap(objectMapper.readTree(customId));
        } catch (JsonProcessingException e) {
            log.debug("PayPal custom_id is not JSON: {}", customId);
            return Map.of();
        }
    }

    private static String disputeId(JsonNode dispute) {
        String disputeId = text(dispute, "dispute_id");
        return disputeId != null ? disputeId : text(dispute, "id");
    }

    private static String currency(JsonNode amount) {
        String currency = text(amount, "currency_code");
        if (currency == null) {
            currency = text(amount, "currency");
        }
        return currency == null ? null : currency.toUpperCase(Locale.ROOT);
    }

    private static String captureIdFromLinks(JsonNode links) {
        if (links == null || !links.isArray()) {
            return null;
        }
        for (JsonNode link : links) {
            if ("up".equals(text(link, "rel"))) {
                String href = text(link, "href");
                if (href != null && href.contains("/captures/")) {
                    return href.substring(href.lastIndexOf('/') + 1);
                }
            }
        }
        return null;
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable PayPal timestamp '{}'", value);
            return null;
        }
    }
}
