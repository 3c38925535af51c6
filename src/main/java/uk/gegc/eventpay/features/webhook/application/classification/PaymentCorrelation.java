package uk.gegc.eventpay.features.webhook.application.classification;

/**
 * Identifiers that tie a provider event back to a stored order. {@code orderId} comes from
 * metadata we attached at checkout; the others are provider-native ids stored on the order.
 */
public record PaymentCorrelation(
        String orderId,
        String stripePaymentIntentId,
        String paypalOrderId,
        String paypalCaptureId
) {
    public static PaymentCorrelation none() {
        return new PaymentCorrelation(null, null, null, null);
    }

    public static PaymentCorrelation stripe(String orderId, String paymentIntentId) {
        return new PaymentCorrelation(orderId, paymentIntentId, null, null);
    }

    public static PaymentCorrelation paypal(String orderId, String paypalOrderId, String captureId) {
        return new PaymentCorrelation(orderId, null, paypalOrderId, captureId);
    }

    public boolean hasNativeId() {
        return stripePaymentIntentId != null || paypalOrderId != null || paypalCaptureId != null;
    }

    public boolean hasOrderId() {
        return orderId != null;
    }

    public boolean isEmpty() {
        return !hasOrderId() && !hasNativeId();
    }

    /** Provider id recorded on the order when it is paid: the Stripe payment intent or the PayPal capture. */
    public String providerPaymentId() {
        if (stripePaymentIntentId != null) {
            return stripePaymentIntentId;
        }
        return paypalCaptureId != null ? paypalCaptureId : paypalOrderId;
    }
}
