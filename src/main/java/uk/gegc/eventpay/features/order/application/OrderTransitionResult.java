package uk.gegc.eventpay.features.order.application;

import uk.gegc.eventpay.features.order.domain.model.OrderStatus;

import java.util.UUID;

/**
 * Result of asking the order state machine for a transition. Only {@link Outcome#APPLIED}
 * means the store changed.
 */
public record OrderTransitionResult(Outcome outcome, UUID orderId, OrderStatus status) {

    public enum Outcome {
        APPLIED,
        /** Order already in the requested state (alreadyPaid / alreadyFailed / alreadyRefunded). */
        ALREADY_IN_STATE,
        /** Transition would move the order backwards; nothing changed. */
        REJECTED,
        NOT_FOUND
    }

    public static OrderTransitionResult applied(UUID orderId, OrderStatus status) {
        return new OrderTransitionResult(Outcome.APPLIED, orderId, status);
    }

    public static OrderTransitionResult alreadyInState(UUID orderId, OrderStatus status) {
        return new OrderTransitionResult(Outcome.ALREADY_IN_STATE, orderId, status);
    }

    public static OrderTransitionResult rejected(UUID orderId, OrderStatus status) {
        return new OrderTransitionResult(Outcome.REJECTED, orderId, status);
    }

    public static OrderTransitionResult notFound() {
        return new OrderTransitionResult(Outcome.NOT_FOUND, null, null);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public boolean orderFound() {
        return outcome != Outcome.NOT_FOUND;
    }
}
