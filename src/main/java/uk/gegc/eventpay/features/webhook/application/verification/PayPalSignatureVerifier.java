package uk.gegc.eventpay.features.webhook.application.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.eventpay.features.webhook.application.PayPalProperties;
import uk.gegc.eventpay.features.webhook.application.WebhookProperties;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.features.webhook.infra.paypal.PayPalApiClient;
import uk.gegc.eventpay.features.webhook.infra.paypal.PayPalApiException;
import uk.gegc.eventpay.features.webhook.infra.paypal.PayPalSignatureHeaders;

/**
 * Delegates verification to PayPal's {@code verify-webhook-signature} endpoint. There is no local
 * certificate check: if PayPal cannot be reached the delivery is rejected and PayPal redelivers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PayPalSignatureVerifier implements WebhookVerifier {

    public static final String TRANSMISSION_ID_HEADER = "paypal-transmission-id";
    public static final String TRANSMISSION_TIME_HEADER = "paypal-transmission-time";
    public static final String CERT_URL_HEADER = "paypal-cert-url";
    public static final String AUTH_ALGO_HEADER = "paypal-auth-algo";
    public static final String TRANSMISSION_SIG_HEADER = "paypal-transmission-sig";

    private final PayPalProperties payPalProperties;
    private final WebhookProperties webhookProperties;
    private final PayPalApiClient payPalApiClient;
    private final ObjectMapper objectMapper;

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.PAYPAL;
    }

    @Override
    public VerificationResult verify(WebhookRequest request) {
        if (!payPalProperties.hasWebhookId()) {
            if (webhookProperties.isProduction()) {
                log.error("PayPal webhook id is not configured in production; refusing delivery");
                return VerificationResult.UNCONFIGURED;
            }
            log.warn("SECURITY: PayPal webhook id not configured, processing delivery WITHOUT signature verification (environment={})",
                    webhookProperties.getEnvironment());
            return VerificationResult.UNVERIFIED_ALLOWED;
        }

        PayPalSignatureHeaders headers = new PayPalSignatureHeaders(
                request.header(TRANSMISSION_ID_HEADER),
                request.header(TRANSMISSION_TIME_HEADER),
                request.header(CERT_URL_HEADER),
                request.header(AUTH_ALGO_HEADER),
                request.header(TRANSMISSION_SIG_HEADER));
        if (!headers.isComplete()) {
            log.warn("PayPal webhook rejected: missing transmission headers");
            return VerificationResult.INVALID;
        }

        if (!payPalProperties.hasClientCredentials()) {
            log.error("PayPal client credentials are not configured; cannot verify webhook");
            return VerificationResult.INVALID;
        }

        JsonNode event;
        try {
            event = objectMapper.readTree(request.payload());
        } catch (JsonProcessingException e) {
            log.warn("PayPal webhook rejected: body is not valid JSON");
            return VerificationResult.INVALID;
        }

        try {
            boolean verified = payPalApiClient.verifyWebhookSignature(headers, event);
            if (!verified) {
                log.warn("PayPal rejected webhook signature for transmission {}", headers.transmissionId());
                return VerificationResult.INVALID;
            }
            return VerificationResult.VALID;
        } catch (PayPalApiException e) {
            log.error("PayPal webhook verification unavailable: {}", e.getMessage());
            return VerificationResult.INVALID;
        }
    }
}
