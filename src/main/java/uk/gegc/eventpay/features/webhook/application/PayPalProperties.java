package uk.gegc.eventpay.features.webhook.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * PayPal REST credentials and the webhook id registered in the PayPal dashboard.
 */
@Configuration
@ConfigurationProperties(prefix = "paypal")
@Validated
@Data
public class PayPalProperties {
    private String clientId;

    private String clientSecret;

    /** Id of the webhook subscription; PayPal verifies signatures against it. */
    private String webhookId;

    /** {@code https://api-m.paypal.com} live, {@code https://api-m.sandbox.paypal.com} sandbox. */
    @NotBlank
    private String apiBaseUrl = "https://api-m.sandbox.paypal.com";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    public boolean hasClientCredentials() {
        return clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }

    public boolean hasWebhookId() {
        return webhookId != null && !webhookId.isBlank();
    }
}
