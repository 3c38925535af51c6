package uk.gegc.eventpay.features.notification.application;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "eventpay.notifications")
@Validated
@Data
public class NotificationProperties {

    private boolean enabled = true;

    /** Base URL of the web app that sends customer emails. */
    @NotBlank
    private String appBaseUrl = "http://localhost:3000";

    @NotBlank
    private String refundPath = "/api/send-refund-notification";

    private Duration timeout = Duration.ofSeconds(5);
}
