package uk.gegc.eventpay.features.webhook.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import uk.gegc.eventpay.features.webhook.api.dto.WebhookAckResponse;
import uk.gegc.eventpay.features.webhook.application.WebhookProcessingService;
import uk.gegc.eventpay.features.webhook.application.WebhookReceipt;
import uk.gegc.eventpay.features.webhook.application.verification.WebhookRequest;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.shared.api.problem.ProblemDetailBuilder;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Shared request handling for provider webhook endpoints: request id, raw headers and the
 * acknowledgement body.
 */
abstract class AbstractWebhookController {

    static final String REQUEST_ID_HEADER = "x-request-id";

    private final WebhookProcessingService webhookService;

    protected AbstractWebhookController(WebhookProcessingService webhookService) {
        this.webhookService = webhookService;
    }

    protected ResponseEntity<WebhookAckResponse> handle(WebhookProvider provider, String payload, HttpServletRequest request) {
        String requestId = resolveRequestId(provider, request);
        request.setAttribute(ProblemDetailBuilder.REQUEST_ID_ATTRIBUTE, requestId);

        WebhookReceipt receipt = webhookService.process(
                new WebhookRequest(provider, payload, headers(request)), requestId);

        return ResponseEntity.ok()
                .header(REQUEST_ID_HEADER, requestId)
                .body(WebhookAckResponse.of(requestId, receipt.isDuplicate()));
    }

    static String resolveRequestId(WebhookProvider provider, HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        return provider.slug() + "-wh-" + UUID.randomUUID();
    }

    private static Map<String, String> headers(HttpServletRequest request) {
        Map<String, String> headers = new HashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        return headers;
    }
}
