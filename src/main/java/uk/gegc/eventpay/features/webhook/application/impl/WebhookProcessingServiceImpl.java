package uk.gegc.eventpay.features.webhook.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.eventpay.features.webhook.application.RoutingOutcome;
import uk.gegc.eventpay.features.webhook.application.WebhookEventLedger;
import uk.gegc.eventpay.features.webhook.application.WebhookIntentRouter;
import uk.gegc.eventpay.features.webhook.application.WebhookLoggingContext;
import uk.gegc.eventpay.features.webhook.application.WebhookMetricsService;
import uk.gegc.eventpay.features.webhook.application.WebhookProcessingService;
import uk.gegc.eventpay.features.webhook.application.WebhookReceipt;
import uk.gegc.eventpay.features.webhook.application.classification.EventClassifier;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookEnvelope;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.application.verification.VerificationResult;
import uk.gegc.eventpay.features.webhook.application.verification.WebhookRequest;
import uk.gegc.eventpay.features.webhook.application.verification.WebhookVerifier;
import uk.gegc.eventpay.features.webhook.domain.exception.MalformedWebhookPayloadException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookSignatureException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookVerificationUnavailableException;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class WebhookProcessingServiceImpl implements WebhookProcessingService {

    private final Map<WebhookProvider, WebhookVerifier> verifiers = new EnumMap<>(WebhookProvider.class);
    private final Map<WebhookProvider, EventClassifier> classifiers = new EnumMap<>(WebhookProvider.class);
    private final WebhookEventLedger ledger;
    private final WebhookIntentRouter router;
    private final WebhookMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public WebhookProcessingServiceImpl(List<WebhookVerifier> verifiers,
                                        List<EventClassifier> classifiers,
                                        WebhookEventLedger ledger,
                                        WebhookIntentRouter router,
                                        WebhookMetricsService metricsService,
                                        TransactionTemplate transactionTemplate,
                                        ObjectMapper objectMapper) {
        verifiers.forEach(v -> this.verifiers.put(v.provider(), v));
        classifiers.forEach(c -> this.classifiers.put(c.provider(), c));
        this.ledger = ledger;
        this.router = router;
        this.metricsService = metricsService;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public WebhookReceipt process(WebhookRequest request, String requestId) {
        long startTime = System.currentTimeMillis();
        WebhookProvider provider = request.provider();

        verify(request, requestId);
        WebhookEnvelope envelope = parse(request);
        String eventId = envelope.eventId();
        String type = envelope.eventType();

        metricsService.incrementReceived(provider, type);
        WebhookLoggingContext loggingContext = WebhookLoggingContext.builder()
                .requestId(requestId)
                .provider(provider)
                .eventId(eventId)
                .eventType(type)
                .build();

        try {
            if (ledger.isProcessed(provider, eventId)) {
                loggingContext.logInfo(log, "Duplicate {} event received; id={} type={}", provider.slug(), eventId, type);
                metricsService.incrementDuplicate(provider, type);
                return new WebhookReceipt(Result.DUPLICATE, requestId, eventId, type);
            }

            WebhookIntent intent = classifierFor(provider).classify(envelope);
            loggingContext.logInfo(log, "Processing {} event id={} type={} as {}",
                    provider.slug(), eventId, type, intent.getClass().getSimpleName());

            Result result;
            try {
                result = transactionTemplate.execute(status -> {
                    RoutingOutcome outcome = router.route(provider, intent, loggingContext);
                    if (!ledger.markProcessed(provider, eventId, type, intent.linkedOrderId())) {
                        // A twin delivery committed first; discard whatever this one wrote
                        status.setRollbackOnly();
                        return Result.DUPLICATE;
                    }
                    return intent instanceof WebhookIntent.Ignored || outcome == RoutingOutcome.UNMATCHED
                            ? Result.IGNORED
                            : Result.OK;
                });
            } catch (DataIntegrityViolationException e) {
                if (!ledger.isProcessed(provider, eventId)) {
                    throw e;
                }
                loggingContext.logInfo(log, "Concurrent delivery of {} event {} already committed", provider.slug(), eventId);
                result = Result.DUPLICATE;
            }

            switch (result) {
                case OK -> metricsService.incrementOk(provider, type);
                case DUPLICATE -> metricsService.incrementDuplicate(provider, type);
                case IGNORED -> metricsService.incrementIgnored(provider, type);
            }
            metricsService.recordLatency(provider, type, System.currentTimeMillis() - startTime);
            return new WebhookReceipt(result, requestId, eventId, type);
        } catch (RuntimeException e) {
            metricsService.incrementFailed(provider, type);
            loggingContext.logError(log, "Failed to process {} webhook event id={} type={}",
                    provider.slug(), eventId, type, e);
            throw e; // 500 so the provider retries
        } finally {
            WebhookLoggingContext.clearMDC();
        }
    }

    private void verify(WebhookRequest request, String requestId) {
        WebhookProvider provider = request.provider();
        WebhookVerifier verifier = verifiers.get(provider);
        if (verifier == null) {
            throw new IllegalStateException("No webhook verifier registered for " + provider.slug());
        }

        VerificationResult result = verifier.verify(request);
        switch (result) {
            case INVALID -> {
                metricsService.incrementRejected(provider, "invalid_signature");
                log.warn("Rejected {} webhook {}: signature verification failed", provider.slug(), requestId);
                throw new WebhookSignatureException(provider, "Invalid " + provider.slug() + " webhook signature");
            }
            case UNCONFIGURED -> {
                metricsService.incrementRejected(provider, "verification_unconfigured");
                log.error("Rejected {} webhook {}: verification is not configured", provider.slug(), requestId);
                throw new WebhookVerificationUnavailableException(provider,
                        "Webhook verification is not configured for " + provider.slug());
            }
            case VALID, UNVERIFIED_ALLOWED -> {
                // proceed
            }
        }
    }

    private WebhookEnvelope parse(WebhookRequest request) {
        JsonNode body;
        try {
            body = objectMapper.readTree(request.payload());
        } catch (JsonProcessingException e) {
            metricsService.incrementRejected(request.provider(), "malformed_payload");
            throw new MalformedWebhookPayloadException("Webhook body is not valid JSON", e);
        }
        if (body == null || !body.isObject()) {
            metricsService.incrementRejected(request.provider(), "malformed_payload");
            throw new MalformedWebhookPayloadException("Webhook body is not a JSON object");
        }

        WebhookEnvelope envelope = classifierFor(request.provider()).envelope(body);
        if (envelope.eventId() == null || envelope.eventType() == null) {
            metricsService.incrementRejected(request.provider(), "malformed_payload");
            throw new MalformedWebhookPayloadException("Webhook event is missing its id or type");
        }
        return envelope;
    }

    private EventClassifier classifierFor(WebhookProvider provider) {
        EventClassifier classifier = classifiers.get(provider);
        if (classifier == null) {
            throw new IllegalStateException("No event classifier registered for " + provider.slug());
        }
        return classifier;
    }
}
