package uk.gegc.eventpay.features.order.domain.model;

/**
 * Ticket order payment lifecycle. Legal paths are PENDING → COMPLETED → REFUNDED and
 * PENDING → FAILED. PENDING → REFUNDED is accepted for a refund observed before its success
 * event; it is still a subsequence of the legal path.
 */
public enum OrderStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED;

    public boolean canTransitionTo(OrderStatus target) {
        return switch (this) {
            case PENDING -> target == COMPLETED || target == FAILED || target == REFUNDED;
            case COMPLETED -> target == REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }

    public boolean isTerminal() {
        return this == FAILED || this == REFUNDED;
    }
}
