package uk.gegc.eventpay.features.subscription.domain.model;

public enum SubscriptionState {
    ACTIVE,
    PAST_DUE,
    CANCELLED
}
