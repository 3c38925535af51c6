package uk.gegc.eventpay.features.webhook.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.eventpay.features.webhook.domain.exception.MalformedWebhookPayloadException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookEndpointDisabledException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookSignatureException;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookVerificationUnavailableException;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.shared.api.problem.ErrorTypes;
import uk.gegc.eventpay.shared.api.problem.ProblemDetailBuilder;

import java.net.URI;

/**
 * Error handler for webhook endpoints.
 * Maps verification and processing failures to RFC 7807 Problem Detail responses. Providers
 * retry on 5xx, so only genuine downstream failures produce one.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.eventpay.features.webhook.api")
public class WebhookErrorHandler {

    @ExceptionHandler(WebhookSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSignature(WebhookSignatureException ex, HttpServletRequest request) {
        log.warn("Invalid {} webhook signature: {}", ex.getProvider().slug(), ex.getMessage());
        // Stripe expects 400 for a bad signature, PayPal 401
        HttpStatus status = ex.getProvider() == WebhookProvider.PAYPAL ? HttpStatus.UNAUTHORIZED : HttpStatus.BAD_REQUEST;
        return respond(status, ErrorTypes.WEBHOOK_INVALID_SIGNATURE, "Invalid Webhook Signature",
                ex.getMessage(), request, ex.getProvider());
    }

    @ExceptionHandler(WebhookVerificationUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleVerificationUnavailable(WebhookVerificationUnavailableException ex,
                                                                       HttpServletRequest request) {
        log.error("Refusing {} webhook: {}", ex.getProvider().slug(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.WEBHOOK_VERIFICATION_UNCONFIGURED,
                "Webhook Verification Unavailable", ex.getMessage(), request, ex.getProvider());
    }

    @ExceptionHandler(MalformedWebhookPayloadException.class)
    public ResponseEntity<ProblemDetail> handleMalformedPayload(MalformedWebhookPayloadException ex, HttpServletRequest request) {
        log.warn("Malformed webhook payload: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.WEBHOOK_MALFORMED_PAYLOAD, "Malformed Webhook Payload",
                ex.getMessage(), request, providerOf(request));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable webhook body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.MALFORMED_JSON, "Malformed Request Body",
                "Webhook body is missing or unreadable", request, providerOf(request));
    }

    @ExceptionHandler(WebhookEndpointDisabledException.class)
    public ResponseEntity<ProblemDetail> handleEndpointDisabled(WebhookEndpointDisabledException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ErrorTypes.WEBHOOK_ENDPOINT_DISABLED, "Webhook Endpoint Disabled",
                ex.getMessage(), request, ex.getProvider());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Database error while processing webhook", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.DATA_ACCESS_ERROR, "Webhook Processing Error",
                "A database error occurred; the delivery should be retried", request, providerOf(request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error while processing webhook", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.WEBHOOK_PROCESSING_ERROR, "Webhook Processing Error",
                "An unexpected error occurred; the delivery should be retried", request, providerOf(request));
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, URI type, String title, String detail,
                                                  HttpServletRequest request, WebhookProvider provider) {
        String requestId = ensureRequestId(request, provider);
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, title, detail, request);
        return ResponseEntity.status(status)
                .header(AbstractWebhookController.REQUEST_ID_HEADER, requestId)
                .body(problem);
    }

    private static String ensureRequestId(HttpServletRequest request, WebhookProvider provider) {
        String existing = ProblemDetailBuilder.requestId(request);
        if (existing != null) {
            return existing;
        }
        String requestId = AbstractWebhookController.resolveRequestId(provider, request);
        request.setAttribute(ProblemDetailBuilder.REQUEST_ID_ATTRIBUTE, requestId);
        return requestId;
    }

    private static WebhookProvider providerOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri != null && uri.endsWith("/paypal") ? WebhookProvider.PAYPAL : WebhookProvider.STRIPE;
    }
}
