package uk.gegc.eventpay.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.eventpay.features.subscription.application.SubscriptionActivation;
import uk.gegc.eventpay.features.subscription.application.SubscriptionStateMachine;
import uk.gegc.eventpay.features.subscription.application.SubscriptionTransitionResult;
import uk.gegc.eventpay.features.subscription.domain.model.Subscription;
import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionState;
import uk.gegc.eventpay.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionStateMachineImpl implements SubscriptionStateMachine {

    static final String RENEWAL_BILLING_REASON = "subscription_cycle";

    private static final Set<String> ACTIVE_STATUSES = Set.of("active", "trialing");
    // unpaid recovers to active once the latest invoice is paid
    private static final Set<String> PAST_DUE_STATUSES = Set.of("past_due", "unpaid");
    private static final Set<String> CANCELLED_STATUSES = Set.of("canceled", "cancelled", "incomplete_expired");

    private final SubscriptionRepository subscriptionRepository;
    private final Clock clock;

    @Override
    @Transactional
    public SubscriptionTransitionResult handleLifecycle(WebhookIntent.SubscriptionLifecycle lifecycle) {
        return switch (lifecycle.signal()) {
            case DELETED -> cancel(lifecycle.subscriptionId(), lifecycle.providerStatus());
            case INVOICE_PAYMENT_FAILED -> markPastDue(lifecycle.subscriptionId(), lifecycle.attemptCount(), "past_due");
            case INVOICE_PAID -> renewIfCycle(lifecycle);
            case STATUS_CHANGED -> applyStatus(lifecycle);
        };
    }

    private SubscriptionTransitionResult renewIfCycle(WebhookIntent.SubscriptionLifecycle lifecycle) {
        if (!RENEWAL_BILLING_REASON.equals(lifecycle.billingReason())) {
            log.info("Skipping invoice for subscription {}: billing reason {} is not a renewal",
                    lifecycle.subscriptionId(), lifecycle.billingReason());
            return SubscriptionTransitionResult.skipped();
        }
        return renew(lifecycle.subscriptionId(), lifecycle.amountPaidCents());
    }

    private SubscriptionTransitionResult applyStatus(WebhookIntent.SubscriptionLifecycle lifecycle) {
        String status = lifecycle.providerStatus() == null
                ? ""
                : lifecycle.providerStatus().toLowerCase(Locale.ROOT);

        if (ACTIVE_STATUSES.contains(status)) {
            if (lifecycle.userId() == null) {
                log.warn("Subscription {} is {} but carries no userId metadata; cannot activate",
                        lifecycle.subscriptionId(), status);
                return SubscriptionTransitionResult.notFound();
            }
            return activate(new SubscriptionActivation(
                    lifecycle.userId(),
                    SubscriptionPlan.fromMetadata(lifecycle.planMetadata()),
                    lifecycle.subscriptionId(),
                    lifecycle.customerId(),
                    lifecycle.priceId(),
                    status,
                    null));
        }
        if (PAST_DUE_STATUSES.contains(status)) {
            return markPastDue(lifecycle.subscriptionId(), lifecycle.attemptCount(), status);
        }
        if (CANCELLED_STATUSES.contains(status)) {
            return cancel(lifecycle.subscriptionId(), status);
        }

        log.info("Subscription {} reported status '{}'; no state change", lifecycle.subscriptionId(), status);
        return SubscriptionTransitionResult.skipped();
    }

    @Override
    @Transactional
    public SubscriptionTransitionResult activate(SubscriptionActivation activation) {
        Optional<Subscription> existing = Optional.empty();
        if (activation.stripeSubscriptionId() != null) {
            existing = subscriptionRepository.findByStripeSubscriptionId(activation.stripeSubscriptionId());
        }
        if (existing.isPresent() && existing.get().getStatus() == SubscriptionState.CANCELLED) {
            log.warn("Refusing to reactivate cancelled subscription {}", activation.stripeSubscriptionId());
            return SubscriptionTransitionResult.rejected(existing.get().getId(), SubscriptionState.CANCELLED);
        }
        if (existing.isEmpty()) {
            existing = subscriptionRepository.findFirstByUserIdAndStatusOrderByCreatedAtDesc(
                    activation.userId(), SubscriptionState.ACTIVE);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        boolean created = existing.isEmpty();
        Subscription subscription = existing.orElseGet(() -> {
            Subscription fresh = new Subscription();
            fresh.setUserId(activation.userId());
            fresh.setStartedAt(now);
            fresh.setCreatedAt(now);
            return fresh;
        });

        subscription.applyPlan(activation.plan());
        subscription.setStatus(SubscriptionState.ACTIVE);
        subscription.setProviderStatus(activation.providerStatus());
        subscription.setAttemptCount(null);
        if (activation.stripeSubscriptionId() != null) {
            subscription.setStripeSubscriptionId(activation.stripeSubscriptionId());
        }
        if (activation.stripeCustomerId() != null) {
            subscription.setStripeCustomerId(activation.stripeCustomerId());
        }
        if (activation.stripePriceId() != null) {
            subscription.setStripePriceId(activation.stripePriceId());
        }
        subscription.setExpiresAt(expiryFrom(now, activation.plan()));
        if (activation.paymentAmountCents() != null) {
            subscription.setLastPaymentAmountCents(activation.paymentAmountCents());
            subscription.setLastPaymentAt(now);
        }
        subscription.setUpdatedAt(now);
        Subscription saved = subscriptionRepository.save(subscription);

        log.info("Subscription {} for user {} {} on plan {}", saved.getId(), activation.userId(),
                created ? "created" : "updated", activation.plan());
        return created
                ? SubscriptionTransitionResult.created(saved.getId(), SubscriptionState.ACTIVE)
                : SubscriptionTransitionResult.updated(saved.getId(), SubscriptionState.ACTIVE);
    }

    @Override
    @Transactional
    public SubscriptionTransitionResult markPastDue(String stripeSubscriptionId, Integer attemptCount, String providerStatus) {
        Optional<Subscription> found = findByProviderId(stripeSubscriptionId);
        if (found.isEmpty()) {
            return SubscriptionTransitionResult.notFound();
        }

        Subscription subscription = found.get();
        if (subscription.getStatus() == SubscriptionState.CANCELLED) {
            log.warn("Ignoring payment failure for cancelled subscription {}", stripeSubscriptionId);
            return SubscriptionTransitionResult.rejected(subscription.getId(), SubscriptionState.CANCELLED);
        }

        boolean alreadyPastDue = subscription.getStatus() == SubscriptionState.PAST_DUE;
        subscription.setStatus(SubscriptionState.PAST_DUE);
        subscription.setProviderStatus(providerStatus);
        if (attemptCount != null) {
            subscription.setAttemptCount(attemptCount);
        }
        subscription.setUpdatedAt(LocalDateTime.now(clock));
        subscriptionRepository.save(subscription);

        log.warn("Subscription {} is past due (attempt {})", stripeSubscriptionId, attemptCount);
        return alreadyPastDue
                ? SubscriptionTransitionResult.alreadyInState(subscription.getId(), SubscriptionState.PAST_DUE)
                : SubscriptionTransitionResult.updated(subscription.getId(), SubscriptionState.PAST_DUE);
    }

    @Override
    @Transactional
    public SubscriptionTransitionResult cancel(String stripeSubscriptionId, String providerStatus) {
        Optional<Subscription> found = findByProviderId(stripeSubscriptionId);
        if (found.isEmpty()) {
            return SubscriptionTransitionResult.notFound();
        }

        Subscription subscription = found.get();
        if (subscription.getStatus() == SubscriptionState.CANCELLED) {
            log.info("Subscription {} already cancelled", stripeSubscriptionId);
            return SubscriptionTransitionResult.alreadyInState(subscription.getId(), SubscriptionState.CANCELLED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        subscription.setStatus(SubscriptionState.CANCELLED);
        subscription.setProviderStatus(providerStatus);
        subscription.setCancelledAt(now);
        subscription.setExpiresAt(now);
        subscription.setUpdatedAt(now);
        subscriptionRepository.save(subscription);

        log.info("Subscription {} cancelled", stripeSubscriptionId);
        return SubscriptionTransitionResult.updated(subscription.getId(), SubscriptionState.CANCELLED);
    }

    @Override
    @Transactional
    public SubscriptionTransitionResult renew(String stripeSubscriptionId, Long amountPaidCents) {
        Optional<Subscription> found = findByProviderId(stripeSubscriptionId);
        if (found.isEmpty()) {
            return SubscriptionTransitionResult.notFound();
        }

        Subscription subscription = found.get();
        if (subscription.getStatus() == SubscriptionState.CANCELLED) {
            log.warn("Renewal paid for cancelled subscription {}; manual review required", stripeSubscriptionId);
            return SubscriptionTransitionResult.rejected(subscription.getId(), SubscriptionState.CANCELLED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        subscription.setStatus(SubscriptionState.ACTIVE);
        subscription.setProviderStatus("active");
        subscription.setAttemptCount(null);
        subscription.setExpiresAt(expiryFrom(now, subscription.getPlan()));
        subscription.setLastPaymentAt(now);
        if (amountPaidCents != null) {
            subscription.setLastPaymentAmountCents(amountPaidCents);
        }
        subscription.setUpdatedAt(now);
        subscriptionRepository.save(subscription);

        log.info("Subscription {} renewed until {}", stripeSubscriptionId, subscription.getExpiresAt());
        return SubscriptionTransitionResult.updated(subscription.getId(), SubscriptionState.ACTIVE);
    }

    private Optional<Subscription> findByProviderId(String stripeSubscriptionId) {
        if (stripeSubscriptionId == null) {
            log.warn("Subscription event without a subscription id; nothing to update");
            return Optional.empty();
        }
        Optional<Subscription> found = subscriptionRepository.findByStripeSubscriptionId(stripeSubscriptionId);
        if (found.isEmpty()) {
            log.warn("No subscription found for provider id {}", stripeSubscriptionId);
        }
        return found;
    }

    private static LocalDateTime expiryFrom(LocalDateTime now, SubscriptionPlan plan) {
        return plan.getDurationDays() == null ? null : now.plusDays(plan.getDurationDays());
    }
}
