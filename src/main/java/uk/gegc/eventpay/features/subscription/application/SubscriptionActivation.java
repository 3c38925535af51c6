package uk.gegc.eventpay.features.subscription.application;

import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionPlan;

/**
 * Everything needed to start or upgrade a subscription.
 *
 * @param paymentAmountCents amount charged for the activation, {@code null} when the event carries none
 */
public record SubscriptionActivation(
        String userId,
        SubscriptionPlan plan,
        String stripeSubscriptionId,
        String stripeCustomerId,
        String stripePriceId,
        String providerStatus,
        Long paymentAmountCents
) {
}
