package uk.gegc.eventpay.features.order.application;

import uk.gegc.eventpay.features.order.domain.model.PaymentMethod;
import uk.gegc.eventpay.features.webhook.application.classification.PaymentCorrelation;

import java.util.UUID;

/**
 * Monotonic ticket-order payment transitions. Every operation is idempotent: re-applying the
 * current state is reported, never re-executed, and backward moves are refused without throwing.
 */
public interface OrderStateMachine {

    /**
     * PENDING → COMPLETED. Looks the order up by metadata order id first, then by provider ids.
     */
    OrderTransitionResult markPaid(PaymentCorrelation correlation, PaymentMethod paymentMethod);

    /**
     * PENDING → FAILED.
     */
    OrderTransitionResult markFailed(PaymentCorrelation correlation, String reason);

    /**
     * COMPLETED (or PENDING) → REFUNDED. Provider ids are tried before the metadata order id.
     * With neither usable the refund is reported {@code NOT_FOUND} and left for manual reconciliation.
     */
    OrderTransitionResult markRefunded(PaymentCorrelation correlation, long refundedAmountCents, String reason);

    OrderTransitionResult markRefunded(UUID orderId, long refundedAmountCents, String reason);
}
