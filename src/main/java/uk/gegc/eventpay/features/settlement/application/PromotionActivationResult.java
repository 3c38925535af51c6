package uk.gegc.eventpay.features.settlement.application;

import java.time.LocalDateTime;
import java.util.UUID;

public record PromotionActivationResult(Outcome outcome, UUID promotionId, LocalDateTime expiresAt) {

    public enum Outcome {
        CREATED,
        ACTIVATED,
        ALREADY_ACTIVE
    }
}
