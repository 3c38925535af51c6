package uk.gegc.eventpay.features.subscription.application;

import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionState;

import java.util.UUID;

public record SubscriptionTransitionResult(Outcome outcome, UUID subscriptionId, SubscriptionState status) {

    public enum Outcome {
        CREATED,
        UPDATED,
        ALREADY_IN_STATE,
        REJECTED,
        SKIPPED,
        NOT_FOUND
    }

    public static SubscriptionTransitionResult created(UUID id, SubscriptionState status) {
        return new SubscriptionTransitionResult(Outcome.CREATED, id, status);
    }

    public static SubscriptionTransitionResult updated(UUID id, SubscriptionState status) {
        return new SubscriptionTransitionResult(Outcome.UPDATED, id, status);
    }

    public static SubscriptionTransitionResult alreadyInState(UUID id, SubscriptionState status) {
        return new SubscriptionTransitionResult(Outcome.ALREADY_IN_STATE, id, status);
    }

    public static SubscriptionTransitionResult rejected(UUID id, SubscriptionState status) {
        return new SubscriptionTransitionResult(Outcome.REJECTED, id, status);
    }

    public static SubscriptionTransitionResult skipped() {
        return new SubscriptionTransitionResult(Outcome.SKIPPED, null, null);
    }

    public static SubscriptionTransitionResult notFound() {
        return new SubscriptionTransitionResult(Outcome.NOT_FOUND, null, null);
    }

    public boolean isChanged() {
        return outcome == Outcome.CREATED || outcome == Outcome.UPDATED;
    }
}
