package uk.gegc.eventpay.features.webhook.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Deployment-wide webhook settings.
 */
@Configuration
@ConfigurationProperties(prefix = "eventpay.webhooks")
@Validated
@Data
public class WebhookProperties {
    /**
     * Deployment environment. In {@code production} a provider without verification
     * credentials is refused; anywhere else it is accepted with a warning.
     */
    @NotBlank
    private String environment = "development";

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment) || "prod".equalsIgnoreCase(environment);
    }
}
