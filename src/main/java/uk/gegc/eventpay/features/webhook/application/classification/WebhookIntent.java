package uk.gegc.eventpay.features.webhook.application.classification;

import java.time.LocalDateTime;

/**
 * Provider-neutral meaning of a webhook event. Classifiers produce exactly one intent per
 * delivery; everything downstream works on intents and never on provider payloads.
 */
public sealed interface WebhookIntent permits
        WebhookIntent.PaymentSucceeded,
        WebhookIntent.PaymentFailed,
        WebhookIntent.PaymentRefunded,
        WebhookIntent.CheckoutApproved,
        WebhookIntent.DisputeOpened,
        WebhookIntent.DisputeResolved,
        WebhookIntent.SubscriptionLifecycle,
        WebhookIntent.AccountStatusChanged,
        WebhookIntent.Ignored {

    /** Order id to record in the dedup ledger, when the event names one. */
    default String linkedOrderId() {
        return null;
    }

    record PaymentSucceeded(PaymentCorrelation correlation, long amountCents, String currency, PaymentPurpose purpose)
            implements WebhookIntent {

        @Override
        public String linkedOrderId() {
            return purpose.orderId() != null ? purpose.orderId() : correlation.orderId();
        }
    }

    record PaymentFailed(PaymentCorrelation correlation, String reason) implements WebhookIntent {

        @Override
        public String linkedOrderId() {
            return correlation.orderId();
        }
    }

    record PaymentRefunded(PaymentCorrelation correlation, long amountCents, String reason) implements WebhookIntent {

        @Override
        public String linkedOrderId() {
            return correlation.orderId();
        }
    }

    /** Buyer approved a PayPal order; capture has not happened yet. */
    record CheckoutApproved(PaymentCorrelation correlation) implements WebhookIntent {

        @Override
        public String linkedOrderId() {
            return correlation.orderId();
        }
    }

    record DisputeOpened(
            String disputeId,
            long amountCents,
            String currency,
            String reason,
            PaymentCorrelation correlation,
            String transactionId,
            String buyerEmail,
            LocalDateTime responseDeadline
    ) implements WebhookIntent {

        @Override
        public String linkedOrderId() {
            return correlation.orderId();
        }
    }

    /**
     * @param outcomeCode raw provider outcome, e.g. PayPal {@code RESOLVED_BUYER_FAVOUR} or Stripe {@code lost}
     */
    record DisputeResolved(String disputeId, String outcomeCode, String outcomeReason) implements WebhookIntent {
    }

    record SubscriptionLifecycle(
            String subscriptionId,
            SubscriptionSignal signal,
            String providerStatus,
            String userId,
            String planMetadata,
            String customerId,
            String priceId,
            Integer attemptCount,
            Long amountPaidCents,
            String billingReason
    ) implements WebhookIntent {
    }

    record AccountStatusChanged(
            String accountId,
            boolean chargesEnabled,
            boolean payoutsEnabled,
            boolean detailsSubmitted,
            boolean requirementsDue
    ) implements WebhookIntent {
    }

    record Ignored(String reason) implements WebhookIntent {
    }
}
