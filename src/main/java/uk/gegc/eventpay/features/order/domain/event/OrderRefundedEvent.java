package uk.gegc.eventpay.features.order.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when an order moves to REFUNDED. Listeners act after the transaction commits.
 */
public class OrderRefundedEvent extends ApplicationEvent {

    private final UUID orderId;
    private final long refundedAmountCents;
    private final String reason;

    public OrderRefundedEvent(Object source, UUID orderId, long refundedAmountCents, String reason) {
        super(source);
        this.orderId = orderId;
        this.refundedAmountCents = refundedAmountCents;
        this.reason = reason;
    }

    public UUID getOrderId() {
        return orderId;
    }

    public long getRefundedAmountCents() {
        return refundedAmountCents;
    }

    public String getReason() {
        return reason;
    }
}
