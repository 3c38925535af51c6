package uk.gegc.eventpay.features.webhook.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Stripe webhook configuration.
 */
@Configuration
@ConfigurationProperties(prefix = "stripe")
@Validated
@Data
public class StripeProperties {
    /** Webhook signing secret for signature verification. */
    private String webhookSecret;

    /** Maximum age of a signed timestamp before the delivery is treated as a replay. */
    @Positive
    private long signatureToleranceSeconds = 300L;

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }
}
