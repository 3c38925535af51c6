package uk.gegc.eventpay.features.webhook.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.eventpay.features.webhook.application.WebhookMetricsService;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed webhook metrics, tagged by provider and event type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookMetricsServiceImpl implements WebhookMetricsService {

    private static final String UNKNOWN = "unknown";

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementReceived(WebhookProvider provider, String eventType) {
        log.debug("METRIC: webhooks.received provider={} eventType={}", provider.slug(), eventType);
        counter("webhooks.received", "Number of webhooks received", provider, "eventType", eventType).increment();
    }

    @Override
    public void incrementOk(WebhookProvider provider, String eventType) {
        log.info("METRIC: webhooks.ok provider={} eventType={}", provider.slug(), eventType);
        counter("webhooks.ok", "Number of webhooks processed successfully", provider, "eventType", eventType).increment();
    }

    @Override
    public void incrementDuplicate(WebhookProvider provider, String eventType) {
        log.info("METRIC: webhooks.duplicate provider={} eventType={}", provider.slug(), eventType);
        counter("webhooks.duplicate", "Number of duplicate webhook deliveries", provider, "eventType", eventType).increment();
    }

    @Override
    public void incrementIgnored(WebhookProvider provider, String eventType) {
        log.info("METRIC: webhooks.ignored provider={} eventType={}", provider.slug(), eventType);
        counter("webhooks.ignored", "Number of webhooks acknowledged without action", provider, "eventType", eventType).increment();
    }

    @Override
    public void incrementRejected(WebhookProvider provider, String reason) {
        log.warn("METRIC: webhooks.rejected provider={} reason={}", provider.slug(), reason);
        counter("webhooks.rejected", "Number of webhooks refused before processing", provider, "reason", reason).increment();
    }

    @Override
    public void incrementFailed(WebhookProvider provider, String eventType) {
        log.error("METRIC: webhooks.failed provider={} eventType={}", provider.slug(), eventType);
        counter("webhooks.failed", "Number of failed webhook processing attempts", provider, "eventType", eventType).increment();
    }

    @Override
    public void recordLatency(WebhookProvider provider, String eventType, long latencyMs) {
        log.debug("METRIC: webhooks.latency provider={} eventType={} latencyMs={}", provider.slug(), eventType, latencyMs);
        Timer.builder("webhooks.latency")
                .description("Webhook processing latency")
                .tag("provider", provider.slug())
                .tag("eventType", eventType != null ? eventType : UNKNOWN)
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    private Counter counter(String name, String description, WebhookProvider provider, String tagKey, String tagValue) {
        return Counter.builder(name)
                .description(description)
                .tag("provider", provider.slug())
                .tag(tagKey, tagValue != null ? tagValue : UNKNOWN)
                .register(meterRegistry);
    }
}
