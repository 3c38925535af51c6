package uk.gegc.eventpay.features.webhook.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.eventpay.features.webhook.api.dto.WebhookAckResponse;
import uk.gegc.eventpay.features.webhook.application.WebhookProcessingService;
import uk.gegc.eventpay.features.webhook.domain.exception.WebhookEndpointDisabledException;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;
import uk.gegc.eventpay.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/webhooks")
@Tag(name = "PayPal Webhooks", description = "Internal endpoint for PayPal webhook events (not for public use)")
public class PayPalWebhookController extends AbstractWebhookController {

    private final FeatureFlags featureFlags;

    public PayPalWebhookController(WebhookProcessingService webhookService, FeatureFlags featureFlags) {
        super(webhookService);
        this.featureFlags = featureFlags;
    }

    @Operation(
            summary = "Handle PayPal webhook",
            description = "Endpoint for PayPal to send capture, refund, checkout and dispute events. "
                    + "The transmission headers are verified with PayPal before anything is processed."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Webhook accepted (possibly as a duplicate)"),
            @ApiResponse(responseCode = "400", description = "Malformed payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Signature verification failed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Signature verification not configured in production",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "PayPal webhooks disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Processing failed; PayPal will retry",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden // Hide from public Swagger UI
    @PostMapping("/paypal")
    public ResponseEntity<WebhookAckResponse> handlePayPalWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            HttpServletRequest request
    ) {
        if (!featureFlags.isPaypalWebhooks()) {
            log.warn("PayPal webhooks are disabled, rejecting delivery");
            throw new WebhookEndpointDisabledException(WebhookProvider.PAYPAL);
        }
        return handle(WebhookProvider.PAYPAL, payload, request);
    }
}
