package uk.gegc.eventpay.features.webhook.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.eventpay.features.webhook.application.WebhookProcessingService;
import uk.gegc.eventpay.features.webhook.application.WebhookReceipt;
import uk.gegc.eventpay.features.webhook.application.verification.WebhookRequest;
import uk.gegc.eventpay.features.webhook.domain.exception.MalformedWebhookPayloadException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookSignatureException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookVerificationUnavailableException;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.shared.config.FeatureFlags;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WebhookControllerWebMvcTest {

    private static final String EVENT = "{\"id\": \"evt_1\", \"type\": \"payment_intent.succeeded\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookProcessingService webhookService;

    @MockitoBean
    private FeatureFlags featureFlags;

    @BeforeEach
    void enableEndpoints() {
        when(featureFlags.isStripeWebhooks()).thenReturn(true);
        when(featureFlags.isPaypalWebhooks()).thenReturn(true);
    }

    @Nested
    @DisplayName("Stripe endpoint")
    class Stripe {

        @Test
        @DisplayName("Processed webhook returns 200 with ack body and request id header")
        void processed_returns200() throws Exception {
            when(webhookService.process(any(), any())).thenAnswer(inv -> new WebhookReceipt(
                    WebhookProcessingService.Result.OK, inv.getArgument(1), "evt_1", "payment_intent.succeeded"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .header("Stripe-Signature", "t=1,v1=abc")
                            .content(EVENT))
                    .andExpect(status().isOk())
                    .andExpect(header().string("x-request-id", startsWith("stripe-wh-")))
                    .andExpect(jsonPath("$.received").value(true))
                    .andExpect(jsonPath("$.requestId", startsWith("stripe-wh-")))
                    .andExpect(jsonPath("$.duplicate").doesNotExist());
        }

        @Test
        @DisplayName("Raw body and headers reach the service untouched")
        void passesRawBody() throws Exception {
            when(webhookService.process(any(), any())).thenReturn(new WebhookReceipt(
                    WebhookProcessingService.Result.OK, "req-7", "evt_1", "payment_intent.succeeded"));
            String body = "{\"id\":\"evt_1\",  \"type\" : \"payment_intent.succeeded\"}";

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .header("Stripe-Signature", "t=1,v1=abc")
                            .header("X-Request-Id", "req-7")
                            .content(body))
                    .andExpect(status().isOk())
                    .andExpect(header().string("x-request-id", "req-7"));

            ArgumentCaptor<WebhookRequest> captor = ArgumentCaptor.forClass(WebhookRequest.class);
            verify(webhookService).process(captor.capture(), eq("req-7"));
            assertThat(captor.getValue().provider()).isEqualTo(WebhookProvider.STRIPE);
            assertThat(captor.getValue().payload()).isEqualTo(body);
            assertThat(captor.getValue().header("stripe-signature")).isEqualTo("t=1,v1=abc");
        }

        @Test
        @DisplayName("Duplicate delivery is acknowledged with duplicate=true")
        void duplicate_returns200() throws Exception {
            when(webhookService.process(any(), any())).thenReturn(new WebhookReceipt(
                    WebhookProcessingService.Result.DUPLICATE, "req-1", "evt_1", "payment_intent.succeeded"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(EVENT))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.received").value(true))
                    .andExpect(jsonPath("$.duplicate").value(true));
        }

        @Test
        @DisplayName("Invalid signature returns 400")
        void invalidSignature_returns400() throws Exception {
            when(webhookService.process(any(), any()))
                    .thenThrow(new WebhookSignatureException(WebhookProvider.STRIPE, "Invalid stripe webhook signature"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(EVENT))
                    .andExpect(status().isBadRequest())
                    .andExpect(header().exists("x-request-id"))
                    .andExpect(jsonPath("$.type", endsWith("/webhook-invalid-signature")))
                    .andExpect(jsonPath("$.requestId", startsWith("stripe-wh-")));
        }

        @Test
        @DisplayName("Verification not configured returns 403")
        void unconfigured_returns403() throws Exception {
            when(webhookService.process(any(), any())).thenThrow(new WebhookVerificationUnavailableException(
                    WebhookProvider.STRIPE, "Webhook verification is not configured for stripe"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(EVENT))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Malformed payload returns 400")
        void malformed_returns400() throws Exception {
            when(webhookService.process(any(), any()))
                    .thenThrow(new MalformedWebhookPayloadException("Webhook body is not valid JSON"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type", endsWith("/webhook-malformed-payload")));
        }

        @Test
        @DisplayName("Empty body returns 400 without reaching the service")
        void emptyBody_returns400() throws Exception {
            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(webhookService);
        }

        @Test
        @DisplayName("Database failure returns 500 so Stripe retries")
        void databaseFailure_returns500() throws Exception {
            when(webhookService.process(any(), any())).thenThrow(new QueryTimeoutException("lock wait timeout"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(EVENT))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.type", endsWith("/data-access-error")));
        }

        @Test
        @DisplayName("Unexpected failure returns 500")
        void unexpected_returns500() throws Exception {
            when(webhookService.process(any(), any())).thenThrow(new IllegalStateException("boom"));

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(EVENT))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.type", endsWith("/webhook-processing-error")));
        }

        @Test
        @DisplayName("Disabled endpoint returns 404")
        void disabled_returns404() throws Exception {
            when(featureFlags.isStripeWebhooks()).thenReturn(false);

            mockMvc.perform(post("/webhooks/stripe")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(EVENT))
                    .andExpect(status().isNotFound());

            verifyNoInteractions(webhookService);
        }
    }

    @Nested
    @DisplayName("PayPal endpoint")
    class PayPal {

        @Test
        @DisplayName("Processed webhook returns 200 with paypal request id")
        void processed_returns200() throws Exception {
            when(webhookService.process(any(), any())).thenAnswer(inv -> new WebhookReceipt(
                    WebhookProcessingService.Result.IGNORED, inv.getArgument(1), "WH-1", "PAYMENT.SALE.COMPLETED"));

            mockMvc.perform(post("/webhooks/paypal")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": \"WH-1\", \"event_type\": \"PAYMENT.SALE.COMPLETED\"}"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("x-request-id", startsWith("paypal-wh-")))
                    .andExpect(jsonPath("$.received").value(true));
        }

        @Test
        @DisplayName("Invalid signature returns 401")
        void invalidSignature_returns401() throws Exception {
            when(webhookService.process(any(), any()))
                    .thenThrow(new WebhookSignatureException(WebhookProvider.PAYPAL, "Invalid paypal webhook signature"));

            mockMvc.perform(post("/webhooks/paypal")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": \"WH-1\"}"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.requestId", startsWith("paypal-wh-")));
        }

        @Test
        @DisplayName("Disabled endpoint returns 404")
        void disabled_returns404() throws Exception {
            when(featureFlags.isPaypalWebhooks()).thenReturn(false);

            mockMvc.perform(post("/webhooks/paypal")
                            .with(csrf())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\": \"WH-1\"}"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.type", endsWith("/webhook-endpoint-disabled")));
        }
    }
}
