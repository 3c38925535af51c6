package uk.gegc.eventpay.features.webhook.integration;

import com.stripe.net.Webhook;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import uk.gegc.eventpay.features.dispute.domain.model.DisputeStatus;
import uk.gegc.eventpay.features.dispute.domain.model.PaymentDispute;
import uk.gegc.eventpay.features.dispute.infra.repository.PaymentDisputeRepository;
import uk.gegc.eventpay.features.order.domain.model.Order;
import uk.gegc.eventpay.features.order.domain.model.OrderStatus;
import uk.gegc.eventpay.features.order.domain.model.PaymentMethod;
import uk.gegc.eventpay.features.order.infra.repository.OrderRepository;
import uk.gegc.eventpay.features.subscription.domain.model.Subscription;
import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionState;
import uk.gegc.eventpay.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.features.webhook.infra.repository.ProcessedWebhookEventRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full deliveries through the HTTP endpoints against the in-memory database. Stripe deliveries are
 * signed with the test secret; PayPal runs unverified because the test profile sets no webhook id.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WebhookReconciliationIntegrationTest {

    private static final String STRIPE_SECRET = "whsec_test_secret";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private OrderRepository orderRepository;
    @Autowired
    private SubscriptionRepository subscriptionRepository;
    @Autowired
    private PaymentDisputeRepository disputeRepository;
    @Autowired
    private ProcessedWebhookEventRepository ledgerRepository;
    @Autowired
    private Clock clock;

    @AfterEach
    void cleanUp() {
        ledgerRepository.deleteAll();
        disputeRepository.deleteAll();
        subscriptionRepository.deleteAll();
        orderRepository.deleteAll();
    }

    private Order pendingOrder(long totalCents) {
        Order order = new Order();
        order.setEventId("EV-1");
        order.setEventName("Summer Festival");
        order.setBuyerEmail("buyer@example.com");
        order.setTicketCount(2);
        order.setSubtotalCents(totalCents);
        order.setFeesCents(0L);
        order.setTotalCents(totalCents);
        order.setStatus(OrderStatus.PENDING);
        order.setCreatedAt(LocalDateTime.now(clock));
        order.setUpdatedAt(order.getCreatedAt());
        return orderRepository.save(order);
    }

    private ResultActions stripe(String payload) throws Exception {
        long timestamp = Instant.now().getEpochSecond();
        String signature = Webhook.Util.computeHmacSha256(STRIPE_SECRET, timestamp + "." + payload);
        return mockMvc.perform(post("/webhooks/stripe")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Stripe-Signature", "t=" + timestamp + ",v1=" + signature)
                .content(payload));
    }

    private ResultActions paypal(String payload) throws Exception {
        return mockMvc.perform(post("/webhooks/paypal")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload));
    }

    @Test
    @DisplayName("Stripe payment completes the order once; replay is acknowledged as duplicate")
    void stripePayment_thenReplay() throws Exception {
        Order order = pendingOrder(5000);
        String payload = """
                {"id": "evt_pay_1", "type": "payment_intent.succeeded",
                 "data": {"object": {"id": "pi_100", "amount": 5000, "currency": "usd",
                                     "metadata": {"orderId": "%s"}}}}
                """.formatted(order.getId());

        stripe(payload)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.duplicate").doesNotExist());
        stripe(payload)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));

        Order paid = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(paid.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(paid.getPaymentMethod()).isEqualTo(PaymentMethod.STRIPE);
        assertThat(paid.getStripePaymentIntentId()).isEqualTo("pi_100");
        assertThat(ledgerRepository.countByProviderAndProviderEventId(WebhookProvider.STRIPE, "evt_pay_1"))
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Stripe refund found by payment intent refunds the order")
    void stripeRefund_byPaymentIntent() throws Exception {
        Order order = pendingOrder(5000);
        order.setStatus(OrderStatus.COMPLETED);
        order.setStripePaymentIntentId("pi_200");
        order.setPaidAt(LocalDateTime.now());
        orderRepository.save(order);

        stripe("""
                {"id": "evt_refund_1", "type": "charge.refunded",
                 "data": {"object": {"id": "ch_1", "payment_intent": "pi_200", "amount_refunded": 2000,
                                     "refunds": {"data": [{"reason": "requested_by_customer"}]}}}}
                """).andExpect(status().isOk());

        Order refunded = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(refunded.getStatus()).isEqualTo(OrderStatus.REFUNDED);
        assertThat(refunded.getRefundedAmountCents()).isEqualTo(2000L);
    }

    @Test
    @DisplayName("Late payment failure does not move a completed order back")
    void stripeFailure_afterPayment_noRegression() throws Exception {
        Order order = pendingOrder(5000);
        order.setStatus(OrderStatus.COMPLETED);
        order.setStripePaymentIntentId("pi_300");
        orderRepository.save(order);

        stripe("""
                {"id": "evt_fail_1", "type": "payment_intent.payment_failed",
                 "data": {"object": {"id": "pi_300", "last_payment_error": {"message": "card declined"}}}}
                """).andExpect(status().isOk());

        assertThat(orderRepository.findById(order.getId()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.COMPLETED);
    }

    @Test
    @DisplayName("Badly signed Stripe delivery is rejected and leaves no trace")
    void stripeBadSignature() throws Exception {
        mockMvc.perform(post("/webhooks/stripe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=" + Instant.now().getEpochSecond() + ",v1=deadbeef")
                        .content("{\"id\": \"evt_bad\", \"type\": \"invoice.paid\", \"data\": {\"object\": {}}}"))
                .andExpect(status().isBadRequest());

        assertThat(ledgerRepository.count()).isZero();
    }

    @Test
    @DisplayName("Unknown payment is acknowledged and recorded without touching orders")
    void stripePayment_unmatched() throws Exception {
        stripe("""
                {"id": "evt_orphan", "type": "payment_intent.succeeded",
                 "data": {"object": {"id": "pi_unknown", "amount": 100, "currency": "usd", "metadata": {}}}}
                """).andExpect(status().isOk());

        assertThat(ledgerRepository.countByProviderAndProviderEventId(WebhookProvider.STRIPE, "evt_orphan"))
                .isEqualTo(1);
    }

    @Test
    @DisplayName("PayPal dispute lifecycle: opened, lost, then replayed")
    void paypalDispute_buyerFavour_refundsOrder() throws Exception {
        Order order = pendingOrder(7500);
        order.setStatus(OrderStatus.COMPLETED);
        order.setPaymentMethod(PaymentMethod.PAYPAL);
        order.setPaypalOrderId("PP-ORDER-1");
        order.setPaypalCaptureId("CAP-1");
        orderRepository.save(order);

        paypal("""
                {"id": "WH-D-1", "event_type": "CUSTOMER.DISPUTE.CREATED",
                 "resource": {"dispute_id": "PP-D-1", "reason": "MERCHANDISE_OR_SERVICE_NOT_RECEIVED",
                              "dispute_amount": {"currency_code": "USD", "value": "75.00"},
                              "seller_response_due_date": "2026-11-01T10:00:00Z",
                              "disputed_transactions": [{"seller_transaction_id": "CAP-1",
                                                         "buyer": {"email": "buyer@example.com"}}]}}
                """).andExpect(status().isOk());

        PaymentDispute opened = disputeRepository.findByDisputeId("PP-D-1").orElseThrow();
        assertThat(opened.getStatus()).isEqualTo(DisputeStatus.OPEN);
        assertThat(opened.getOrderId()).isEqualTo(order.getId());
        assertThat(opened.getAmountCents()).isEqualTo(7500L);

        String resolved = """
                {"id": "WH-D-2", "event_type": "CUSTOMER.DISPUTE.RESOLVED",
                 "resource": {"dispute_id": "PP-D-1",
                              "dispute_outcome": {"outcome_code": "RESOLVED_BUYER_FAVOUR"}}}
                """;
        paypal(resolved).andExpect(status().isOk());
        paypal(resolved)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));

        assertThat(disputeRepository.findByDisputeId("PP-D-1").orElseThrow().getStatus())
                .isEqualTo(DisputeStatus.RESOLVED_BUYER_FAVOUR);
        Order refunded = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(refunded.getStatus()).isEqualTo(OrderStatus.REFUNDED);
        assertThat(refunded.getRefundedAmountCents()).isEqualTo(7500L);
    }

    @Test
    @DisplayName("PayPal capture completes the order found through custom_id")
    void paypalCapture_completesOrder() throws Exception {
        Order order = pendingOrder(1999);
        order.setPaypalOrderId("PP-ORDER-2");
        orderRepository.save(order);

        paypal("""
                {"id": "WH-C-1", "event_type": "PAYMENT.CAPTURE.COMPLETED",
                 "resource": {"id": "CAP-2", "amount": {"currency_code": "USD", "value": "19.99"},
                              "custom_id": "{\\"orderId\\":\\"%s\\",\\"paypalOrderId\\":\\"PP-ORDER-2\\"}"}}
                """.formatted(order.getId())).andExpect(status().isOk());

        Order paid = orderRepository.findById(order.getId()).orElseThrow();
        assertThat(paid.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(paid.getPaymentMethod()).isEqualTo(PaymentMethod.PAYPAL);
        assertThat(paid.getPaypalCaptureId()).isEqualTo("CAP-2");
    }

    @Test
    @DisplayName("Stripe subscription activates on the plan from metadata, then falls past due")
    void stripeSubscription_activateThenPastDue() throws Exception {
        stripe("""
                {"id": "evt_sub_1", "type": "customer.subscription.created",
                 "data": {"object": {"id": "sub_1", "status": "active", "customer": "cus_1",
                                     "metadata": {"userId": "user-1", "plan": "pro"},
                                     "items": {"data": [{"price": {"id": "price_pro"}}]}}}}
                """).andExpect(status().isOk());

        Subscription active = subscriptionRepository.findByStripeSubscriptionId("sub_1").orElseThrow();
        assertThat(active.getStatus()).isEqualTo(SubscriptionState.ACTIVE);
        assertThat(active.getPlan()).isEqualTo(SubscriptionPlan.PRO);
        assertThat(active.getUserId()).isEqualTo("user-1");

        stripe("""
                {"id": "evt_inv_1", "type": "invoice.payment_failed",
                 "data": {"object": {"id": "in_1", "subscription": "sub_1", "customer": "cus_1",
                                     "attempt_count": 2, "status": "open"}}}
                """).andExpect(status().isOk());

        Subscription pastDue = subscriptionRepository.findByStripeSubscriptionId("sub_1").orElseThrow();
        assertThat(pastDue.getStatus()).isEqualTo(SubscriptionState.PAST_DUE);
        assertThat(pastDue.getAttemptCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Same event id from both providers is processed once each")
    void ledgerScopedByProvider() throws Exception {
        String id = "shared-" + UUID.randomUUID();
        stripe("{\"id\": \"" + id + "\", \"type\": \"balance.available\", \"data\": {\"object\": {\"object\": \"balance\"}}}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").doesNotExist());
        paypal("{\"id\": \"" + id + "\", \"event_type\": \"BILLING.PLAN.CREATED\", \"resource\": {}}")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").doesNotExist());
    }
}
