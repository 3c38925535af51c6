package uk.gegc.eventpay.features.webhook.application.classification;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;

import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.at;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.bool;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.first;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.intOrNull;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.longVal;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.text;
import static uk.gegc.eventpay.features.webhook.application.classification.JsonFields.toStringMap;

@Slf4j
@Component
public class StripeEventClassifier implements EventClassifier {

    static final String BILLING_REASON_CYCLE = "subscription_cycle";

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.STRIPE;
    }

    @Override
    public WebhookEnvelope envelope(JsonNode body) {
        return new WebhookEnvelope(text(body, "id"), text(body, "type"), body);
    }

    @Override
    public WebhookIntent classify(WebhookEnvelope envelope) {
        String type = envelope.eventType() == null ? "" : envelope.eventType();
        JsonNode object = envelope.body().path("data").path("object");
        if (object.isMissingNode() || !object.isObject()) {
            return new WebhookIntent.Ignored("Stripe event " + type + " has no data.object");
        }

        return switch (type) {
            case "checkout.session.completed" -> checkoutSessionCompleted(object);
            case "payment_intent.succeeded" -> paymentIntentSucceeded(object);
            case "payment_intent.payment_failed" -> new WebhookIntent.PaymentFailed(
                    PaymentCorrelation.stripe(metadata(object).get("orderId"), text(object, "id")),
                    failureMessage(object));
            case "charge.refunded" -> chargeRefunded(object);
            case "charge.dispute.created" -> disputeCreated(object);
            case "charge.dispute.closed" -> new WebhookIntent.DisputeResolved(
                    text(object, "id"), text(object, "status"), text(object, "reason"));
            case "customer.subscription.created", "customer.subscription.updated" ->
                    subscription(object, SubscriptionSignal.STATUS_CHANGED);
            case "customer.subscription.deleted" -> subscription(object, SubscriptionSignal.DELETED);
            case "invoice.payment_failed" -> invoice(object, SubscriptionSignal.INVOICE_PAYMENT_FAILED);
            case "invoice.paid" -> invoice(object, SubscriptionSignal.INVOICE_PAID);
            case "account.updated" -> accountUpdated(object);
            default -> new WebhookIntent.Ignored("Unhandled Stripe event type: " + type);
        };
    }

    private WebhookIntent checkoutSessionCompleted(JsonNode session) {
        Map<String, String> metadata = metadata(session);
        PaymentPurpose purpose;
        try {
            purpose = PaymentPurposeDecoder.decode(metadata);
        } catch (UnknownPaymentPurposeException e) {
            return ignoredPurpose(e);
        }
        // Marketplace and platform purchases settle on payment_intent.succeeded
        if (!(purpose instanceof PaymentPurpose.TicketOrder)) {
            return new WebhookIntent.Ignored("Checkout session for " + purpose.getClass().getSimpleName()
                    + " is settled by payment_intent.succeeded");
        }
        return new WebhookIntent.PaymentSucceeded(
                PaymentCorrelation.stripe(metadata.get("orderId"), text(session, "payment_intent")),
                longVal(session, "amount_total"),
                upper(text(session, "currency")),
                purpose);
    }

    private WebhookIntent paymentIntentSucceeded(JsonNode paymentIntent) {
        Map<String, String> metadata = metadata(paymentIntent);
        PaymentPurpose purpose;
        try {
            purpose = PaymentPurposeDecoder.decode(metadata);
        } catch (UnknownPaymentPurposeException e) {
            return ignoredPurpose(e);
        }
        return new WebhookIntent.PaymentSucceeded(
                PaymentCorrelation.stripe(metadata.get("orderId"), text(paymentIntent, "id")),
                longVal(paymentIntent, "amount"),
                upper(text(paymentIntent, "currency")),
                purpose);
    }

    private WebhookIntent chargeRefunded(JsonNode charge) {
        JsonNode latestRefund = first(charge.path("refunds").path("data"));
        String reason = text(latestRefund, "reason");
        return new WebhookIntent.PaymentRefunded(
                PaymentCorrelation.stripe(metadata(charge).get("orderId"), text(charge, "payment_intent")),
                longVal(charge, "amount_refunded"),
                reason != null ? reason : "requested_by_customer");
    }

    private WebhookIntent disputeCreated(JsonNode dispute) {
        long dueBy = longVal(dispute.get("evidence_details"), "due_by");
        LocalDateTime deadline = dueBy > 0
                ? LocalDateTime.ofInstant(Instant.ofEpochSecond(dueBy), ZoneOffset.UTC)
                : null;
        return new WebhookIntent.DisputeOpened(
                text(dispute, "id"),
                longVal(dispute, "amount"),
                upper(text(dispute, "currency")),
                text(dispute, "reason") != null ? text(dispute, "reason") : "unknown",
                PaymentCorrelation.stripe(metadata(dispute).get("orderId"), text(dispute, "payment_intent")),
                text(dispute, "charge"),
                null,
                deadline);
    }

    private WebhookIntent subscription(JsonNode subscription, SubscriptionSignal signal) {
        Map<String, String> metadata = metadata(subscription);
        JsonNode firstItem = first(subscription.path("items").path("data"));
        return new WebhookIntent.SubscriptionLifecycle(
                text(subscription, "id"),
                signal,
                text(subscription, "status"),
                metadata.get("userId"),
                metadata.get("plan"),
                text(subscription, "customer"),
                at(firstItem, "price", "id"),
                null,
                null,
                null);
    }

    private WebhookIntent invoice(JsonNode invoice, SubscriptionSignal signal) {
        String subscriptionId = text(invoice, "subscription");
        if (subscriptionId == null) {
            // Newer API versions nest it under parent.subscription_details
            subscriptionId = at(invoice, "parent", "subscription_details", "subscription");
        }
        if (subscriptionId == null) {
            return new WebhookIntent.Ignored("Invoice " + text(invoice, "id") + " is not attached to a subscription");
        }
        return new WebhookIntent.SubscriptionLifecycle(
                subscriptionId,
                signal,
                text(invoice, "status"),
                null,
                null,
                text(invoice, "customer"),
                null,
                intOrNull(invoice, "attempt_count"),
                invoice.has("amount_paid") ? longVal(invoice, "amount_paid") : null,
                text(invoice, "billing_reason"));
    }

    private WebhookIntent accountUpdated(JsonNode account) {
        JsonNode currentlyDue = account.path("requirements").path("currently_due");
        boolean requirementsDue = currentlyDue.isArray() && !currentlyDue.isEmpty();
        return new WebhookIntent.AccountStatusChanged(
                text(account, "id"),
                bool(account, "charges_enabled"),
                bool(account, "payouts_enabled"),
                bool(account, "details_submitted"),
                requirementsDue);
    }

    private WebhookIntent ignoredPurpose(UnknownPaymentPurposeException e) {
        log.warn("Stripe payment with unrecognised purpose ignored: {}", e.getMessage());
        return new WebhookIntent.Ignored(e.getMessage());
    }

    private static Map<String, String> metadata(JsonNode object) {
        return toStringMap(object.get("metadata"));
    }

    private static String failureMessage(JsonNode paymentIntent) {
        String message = at(paymentIntent, "last_payment_error", "message");
        return message != null ? message : "Payment failed";
    }

    private static String upper(String currency) {
        return currency == null ? null : currency.toUpperCase(Locale.ROOT);
    }
}
