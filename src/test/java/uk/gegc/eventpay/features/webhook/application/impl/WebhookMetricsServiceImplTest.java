package uk.gegc.eventpay.features.webhook.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebhookMetricsServiceImpl")
class WebhookMetricsServiceImplTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final WebhookMetricsServiceImpl metrics = new WebhookMetricsServiceImpl(registry);

    @Test
    @DisplayName("Counters are tagged by provider and event type")
    void countersTaggedByProvider() {
        metrics.incrementOk(WebhookProvider.STRIPE, "invoice.paid");
        metrics.incrementOk(WebhookProvider.STRIPE, "invoice.paid");
        metrics.incrementOk(WebhookProvider.PAYPAL, "PAYMENT.CAPTURE.COMPLETED");

        assertThat(registry.get("webhooks.ok").tag("provider", "stripe").tag("eventType", "invoice.paid")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("webhooks.ok").tag("provider", "paypal").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Rejections are tagged by reason, missing event type falls back to unknown")
    void rejectedAndUnknown() {
        metrics.incrementRejected(WebhookProvider.PAYPAL, "invalid_signature");
        metrics.incrementFailed(WebhookProvider.STRIPE, null);

        assertThat(registry.get("webhooks.rejected").tag("reason", "invalid_signature").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("webhooks.failed").tag("eventType", "unknown").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Latency is recorded on a timer")
    void latency() {
        metrics.recordLatency(WebhookProvider.STRIPE, "charge.refunded", 42);

        assertThat(registry.get("webhooks.latency").timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(42.0);
    }
}
