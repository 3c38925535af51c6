package uk.gegc.eventpay.features.webhook.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "WebhookAckResponse", description = "Acknowledgement returned to the payment provider")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAckResponse(
        @Schema(description = "Always true when the delivery was accepted", example = "true")
        boolean received,

        @Schema(description = "Correlation id of this delivery", example = "stripe-wh-4f1c9a7e-0c4e-4c1b-9b44-6a3f0d8c2e11")
        String requestId,

        @Schema(description = "Present and true when the event had already been processed")
        Boolean duplicate
) {
    public static WebhookAckResponse of(String requestId, boolean duplicate) {
        return new WebhookAckResponse(true, requestId, duplicate ? Boolean.TRUE : null);
    }
}
