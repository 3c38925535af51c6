package uk.gegc.eventpay.features.settlement.application;

import uk.gegc.eventpay.features.settlement.domain.model.PromotionType;

/**
 * Fulfils products the platform sells directly to organizers.
 */
public interface PlatformProductService {

    CreditPurchaseResult confirmCreditPurchase(CreditPurchase purchase);

    /**
     * Activates the pending promotion paid for by {@code paymentReference}, creating it when the
     * payment arrives before the checkout stored one.
     */
    PromotionActivationResult activatePromotion(String eventId, String organizerId, PromotionType type,
                                                String paymentReference, long amountPaidCents);
}
