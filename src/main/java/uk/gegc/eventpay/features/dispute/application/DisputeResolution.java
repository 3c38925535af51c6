package uk.gegc.eventpay.features.dispute.application;

import uk.gegc.eventpay.features.dispute.domain.model.DisputeStatus;

import java.util.UUID;

public record DisputeResolution(Outcome outcome, UUID id, DisputeStatus status, UUID orderId) {

    public enum Outcome {
        RESOLVED,
        ALREADY_RESOLVED,
        NOT_FOUND
    }

    public static DisputeResolution notFound() {
        return new DisputeResolution(Outcome.NOT_FOUND, null, null, null);
    }

    /** True when this call closed the dispute in the buyer's favour and an order is linked. */
    public boolean requiresOrderRefund() {
        return outcome == Outcome.RESOLVED && status == DisputeStatus.RESOLVED_BUYER_FAVOUR && orderId != null;
    }
}
