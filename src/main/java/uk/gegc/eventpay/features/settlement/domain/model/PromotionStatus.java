package uk.gegc.eventpay.features.settlement.domain.model;

public enum PromotionStatus {
    PENDING,
    ACTIVE,
    EXPIRED,
    CANCELLED
}
