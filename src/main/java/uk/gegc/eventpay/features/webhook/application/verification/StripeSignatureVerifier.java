package uk.gegc.eventpay.features.webhook.application.verification;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.eventpay.features.webhook.application.StripeProperties;
import uk.gegc.eventpay.features.webhook.application.WebhookProperties;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

/**
 * Verifies the {@code stripe-signature} header: an HMAC-SHA256 of {@code timestamp.payload}
 * under the endpoint secret, with the timestamp held to the configured tolerance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeSignatureVerifier implements WebhookVerifier {

    public static final String SIGNATURE_HEADER = "stripe-signature";

    private final StripeProperties stripeProperties;
    private final WebhookProperties webhookProperties;

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.STRIPE;
    }

    @Override
    public VerificationResult verify(WebhookRequest request) {
        String sigHeader = request.header(SIGNATURE_HEADER);
        if (sigHeader == null || sigHeader.isBlank()) {
            log.warn("Stripe webhook rejected: missing {} header", SIGNATURE_HEADER);
            return VerificationResult.INVALID;
        }

        if (!stripeProperties.hasWebhookSecret()) {
            if (webhookProperties.isProduction()) {
                log.error("Stripe webhook secret is not configured in production; refusing delivery");
                return VerificationResult.UNCONFIGURED;
            }
            log.warn("SECURITY: Stripe webhook secret not configured, processing delivery WITHOUT signature verification (environment={})",
                    webhookProperties.getEnvironment());
            return VerificationResult.UNVERIFIED_ALLOWED;
        }

        try {
            Webhook.Signature.verifyHeader(
                    request.payload(),
                    sigHeader,
                    stripeProperties.getWebhookSecret(),
                    stripeProperties.getSignatureToleranceSeconds());
            return VerificationResult.VALID;
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            return VerificationResult.INVALID;
        } catch (RuntimeException e) {
            log.warn("Stripe webhook signature could not be checked: {}", e.getMessage());
            return VerificationResult.INVALID;
        }
    }
}
