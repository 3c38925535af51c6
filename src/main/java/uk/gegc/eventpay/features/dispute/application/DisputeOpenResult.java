package uk.gegc.eventpay.features.dispute.application;

import java.util.UUID;

/**
 * @param orderId linked order, {@code null} when no order could be matched
 */
public record DisputeOpenResult(UUID id, boolean alreadyExists, UUID orderId) {
}
