package uk.gegc.eventpay.features.notification.application;

/**
 * Body of the refund email request.
 */
public record RefundNotification(
        String email,
        String customerName,
        String eventName,
        String orderNumber,
        long refundAmount,
        int ticketCount,
        String refundReason
) {
}
