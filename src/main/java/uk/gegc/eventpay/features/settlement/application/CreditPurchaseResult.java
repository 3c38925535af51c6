package uk.gegc.eventpay.features.settlement.application;

public record CreditPurchaseResult(boolean alreadyCompleted, int creditsRemaining) {
}
