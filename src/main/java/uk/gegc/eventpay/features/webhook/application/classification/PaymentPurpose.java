package uk.gegc.eventpay.features.webhook.application.classification;

/**
 * What a payment paid for, decoded once from provider metadata. A payment with no tag is a
 * ticket order.
 */
public sealed interface PaymentPurpose permits
        PaymentPurpose.TicketOrder,
        PaymentPurpose.ProductOrder,
        PaymentPurpose.FoodOrder,
        PaymentPurpose.PlatformProduct {

    /** Stored order the payment settles, or {@code null} for platform products. */
    String orderId();

    /**
     * @param settlementAmountCents platform debt the organizer settles out of this payment, 0 if none
     */
    record TicketOrder(String orderId, long settlementAmountCents, String organizerId, String eventId)
            implements PaymentPurpose {
    }

    /**
     * @param commissionPercent platform commission on the order subtotal
     * @param applicationFeeCents fee the platform retained on the charge
     */
    record ProductOrder(String orderId, String vendorId, int commissionPercent, long applicationFeeCents)
            implements PaymentPurpose {
    }

    record FoodOrder(String orderId) implements PaymentPurpose {
    }

    record PlatformProduct(
            PlatformProductType productType,
            String userId,
            String eventId,
            int ticketQuantity,
            long pricePerTicketCents,
            String subscriptionPlan,
            String stripeCustomerId,
            String stripePriceId,
            String stripeSubscriptionId,
            String promotionType
    ) implements PaymentPurpose {

        @Override
        public String orderId() {
            return null;
        }
    }
}
