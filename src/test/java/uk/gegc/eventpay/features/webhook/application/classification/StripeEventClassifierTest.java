package uk.gegc.eventpay.features.webhook.application.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StripeEventClassifier")
class StripeEventClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StripeEventClassifier classifier = new StripeEventClassifier();

    private WebhookIntent classify(String json) throws Exception {
        JsonNode body = objectMapper.readTree(json);
        return classifier.classify(classifier.envelope(body));
    }

    @Test
    @DisplayName("Envelope reads id and type")
    void envelope_readsIdAndType() throws Exception {
        WebhookEnvelope envelope = classifier.envelope(objectMapper.readTree("""
                {"id": "evt_1", "type": "invoice.paid", "data": {"object": {}}}
                """));

        assertThat(envelope.eventId()).isEqualTo("evt_1");
        assertThat(envelope.eventType()).isEqualTo("invoice.paid");
    }

    @Nested
    @DisplayName("Payments")
    class Payments {

        @Test
        @DisplayName("checkout.session.completed for a ticket order succeeds the payment")
        void checkoutCompleted_ticketOrder() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_1", "type": "checkout.session.completed",
                     "data": {"object": {"id": "cs_1", "payment_intent": "pi_1", "amount_total": 5000,
                                          "currency": "usd", "metadata": {"orderId": "O1"}}}}
                    """);

            assertThat(intent).isInstanceOf(WebhookIntent.PaymentSucceeded.class);
            WebhookIntent.PaymentSucceeded succeeded = (WebhookIntent.PaymentSucceeded) intent;
            assertThat(succeeded.correlation()).isEqualTo(PaymentCorrelation.stripe("O1", "pi_1"));
            assertThat(succeeded.amountCents()).isEqualTo(5000L);
            assertThat(succeeded.currency()).isEqualTo("USD");
            assertThat(succeeded.purpose()).isInstanceOf(PaymentPurpose.TicketOrder.class);
            assertThat(succeeded.linkedOrderId()).isEqualTo("O1");
        }

        @Test
        @DisplayName("checkout.session.completed for a product order is left to payment_intent.succeeded")
        void checkoutCompleted_productOrder_ignored() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_2", "type": "checkout.session.completed",
                     "data": {"object": {"id": "cs_2", "metadata": {"chargeType": "PRODUCT_ORDER", "orderId": "P1"}}}}
                    """);

            assertThat(intent).isInstanceOf(WebhookIntent.Ignored.class);
        }

        @Test
        @DisplayName("payment_intent.succeeded decodes the product purpose")
        void paymentIntentSucceeded_productOrder() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_3", "type": "payment_intent.succeeded",
                     "data": {"object": {"id": "pi_3", "amount": 2000, "currency": "gbp",
                                          "metadata": {"chargeType": "PRODUCT_ORDER", "orderId": "P1",
                                                       "vendorId": "V1", "commissionPercent": "10"}}}}
                    """);

            WebhookIntent.PaymentSucceeded succeeded = (WebhookIntent.PaymentSucceeded) intent;
            assertThat(succeeded.purpose()).isEqualTo(new PaymentPurpose.ProductOrder("P1", "V1", 10, 0L));
            assertThat(succeeded.correlation().stripePaymentIntentId()).isEqualTo("pi_3");
        }

        @Test
        @DisplayName("Unknown charge type is ignored rather than failed")
        void paymentIntentSucceeded_unknownPurpose_ignored() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_4", "type": "payment_intent.succeeded",
                     "data": {"object": {"id": "pi_4", "metadata": {"chargeType": "MYSTERY"}}}}
                    """);

            assertThat(intent).isInstanceOf(WebhookIntent.Ignored.class);
        }

        @Test
        @DisplayName("payment_intent.payment_failed carries the provider message")
        void paymentFailed_readsMessage() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_5", "type": "payment_intent.payment_failed",
                     "data": {"object": {"id": "pi_5", "metadata": {"orderId": "O5"},
                                          "last_payment_error": {"message": "Your card was declined."}}}}
                    """);

            assertThat(intent).isEqualTo(new WebhookIntent.PaymentFailed(
                    PaymentCorrelation.stripe("O5", "pi_5"), "Your card was declined."));
        }

        @Test
        @DisplayName("charge.refunded uses amount_refunded and the latest refund reason")
        void chargeRefunded() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_6", "type": "charge.refunded",
                     "data": {"object": {"id": "ch_6", "payment_intent": "pi_6", "amount_refunded": 1500,
                                          "refunds": {"data": [{"reason": "duplicate"}]}}}}
                    """);

            assertThat(intent).isEqualTo(new WebhookIntent.PaymentRefunded(
                    PaymentCorrelation.stripe(null, "pi_6"), 1500L, "duplicate"));
        }
    }

    @Nested
    @DisplayName("Disputes")
    class Disputes {

        @Test
        @DisplayName("charge.dispute.created converts the evidence deadline to UTC")
        void disputeCreated() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_7", "type": "charge.dispute.created",
                     "data": {"object": {"id": "dp_1", "amount": 5000, "currency": "usd", "reason": "fraudulent",
                                          "charge": "ch_1", "payment_intent": "pi_1",
                                          "evidence_details": {"due_by": 1704110400}}}}
                    """);

            WebhookIntent.DisputeOpened opened = (WebhookIntent.DisputeOpened) intent;
            assertThat(opened.disputeId()).isEqualTo("dp_1");
            assertThat(opened.amountCents()).isEqualTo(5000L);
            assertThat(opened.reason()).isEqualTo("fraudulent");
            assertThat(opened.transactionId()).isEqualTo("ch_1");
            assertThat(opened.responseDeadline()).isEqualTo(LocalDateTime.of(2024, 1, 1, 12, 0));
        }

        @Test
        @DisplayName("charge.dispute.closed passes the Stripe status as outcome")
        void disputeClosed() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_8", "type": "charge.dispute.closed",
                     "data": {"object": {"id": "dp_1", "status": "lost", "reason": "fraudulent"}}}
                    """);

            assertThat(intent).isEqualTo(new WebhookIntent.DisputeResolved("dp_1", "lost", "fraudulent"));
        }
    }

    @Nested
    @DisplayName("Subscriptions and accounts")
    class SubscriptionsAndAccounts {

        @Test
        @DisplayName("customer.subscription.updated reads status, metadata and price")
        void subscriptionUpdated() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_9", "type": "customer.subscription.updated",
                     "data": {"object": {"id": "sub_1", "status": "active", "customer": "cus_1",
                                          "metadata": {"userId": "u1", "plan": "pro"},
                                          "items": {"data": [{"price": {"id": "price_1"}}]}}}}
                    """);

            WebhookIntent.SubscriptionLifecycle lifecycle = (WebhookIntent.SubscriptionLifecycle) intent;
            assertThat(lifecycle.signal()).isEqualTo(SubscriptionSignal.STATUS_CHANGED);
            assertThat(lifecycle.providerStatus()).isEqualTo("active");
            assertThat(lifecycle.userId()).isEqualTo("u1");
            assertThat(lifecycle.planMetadata()).isEqualTo("pro");
            assertThat(lifecycle.priceId()).isEqualTo("price_1");
        }

        @Test
        @DisplayName("invoice.payment_failed carries the attempt count")
        void invoicePaymentFailed() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_10", "type": "invoice.payment_failed",
                     "data": {"object": {"id": "in_1", "subscription": "sub_1", "attempt_count": 2}}}
                    """);

            WebhookIntent.SubscriptionLifecycle lifecycle = (WebhookIntent.SubscriptionLifecycle) intent;
            assertThat(lifecycle.signal()).isEqualTo(SubscriptionSignal.INVOICE_PAYMENT_FAILED);
            assertThat(lifecycle.attemptCount()).isEqualTo(2);
            assertThat(lifecycle.amountPaidCents()).isNull();
        }

        @Test
        @DisplayName("invoice.paid finds the subscription under parent details")
        void invoicePaid_nestedSubscription() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_11", "type": "invoice.paid",
                     "data": {"object": {"id": "in_2", "amount_paid": 2900, "billing_reason": "subscription_cycle",
                                          "parent": {"subscription_details": {"subscription": "sub_2"}}}}}
                    """);

            WebhookIntent.SubscriptionLifecycle lifecycle = (WebhookIntent.SubscriptionLifecycle) intent;
            assertThat(lifecycle.subscriptionId()).isEqualTo("sub_2");
            assertThat(lifecycle.amountPaidCents()).isEqualTo(2900L);
            assertThat(lifecycle.billingReason()).isEqualTo("subscription_cycle");
        }

        @Test
        @DisplayName("Invoice without a subscription is ignored")
        void invoiceWithoutSubscription_ignored() throws Exception {
            assertThat(classify("""
                    {"id": "evt_12", "type": "invoice.paid", "data": {"object": {"id": "in_3"}}}
                    """)).isInstanceOf(WebhookIntent.Ignored.class);
        }

        @Test
        @DisplayName("account.updated flags outstanding requirements")
        void accountUpdated() throws Exception {
            WebhookIntent intent = classify("""
                    {"id": "evt_13", "type": "account.updated",
                     "data": {"object": {"id": "acct_1", "charges_enabled": true, "payouts_enabled": false,
                                          "details_submitted": true,
                                          "requirements": {"currently_due": ["external_account"]}}}}
                    """);

            assertThat(intent).isEqualTo(new WebhookIntent.AccountStatusChanged("acct_1", true, false, true, true));
        }
    }

    @Test
    @DisplayName("Unhandled types and missing data.object are ignored")
    void unhandled_ignored() throws Exception {
        assertThat(classify("""
                {"id": "evt_14", "type": "customer.created", "data": {"object": {"id": "cus_1"}}}
                """)).isInstanceOf(WebhookIntent.Ignored.class);
        assertThat(classify("""
                {"id": "evt_15", "type": "payment_intent.succeeded"}
                """)).isInstanceOf(WebhookIntent.Ignored.class);
    }
}
