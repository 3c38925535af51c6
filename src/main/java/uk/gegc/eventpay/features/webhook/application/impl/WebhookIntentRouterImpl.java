package uk.gegc.eventpay.features.webhook.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.eventpay.features.account.application.AccountStatusService;
import uk.gegc.eventpay.features.dispute.application.DisputeOpenResult;
import uk.gegc.eventpay.features.dispute.application.DisputeResolution;
import uk.gegc.eventpay.features.dispute.application.DisputeTracker;
import uk.gegc.eventpay.features.order.application.OrderStateMachine;
import uk.gegc.eventpay.features.order.application.OrderTransitionResult;
import uk.gegc.eventpay.features.settlement.application.SettlementReconciler;
import uk.gegc.eventpay.features.settlement.application.SettlementResult;
import uk.gegc.eventpay.features.subscription.application.SubscriptionStateMachine;
import uk.gegc.eventpay.features.subscription.application.SubscriptionTransitionResult;
import uk.gegc.eventpay.features.webhook.application.RoutingOutcome;
import uk.gegc.eventpay.features.webhook.application.WebhookIntentRouter;
import uk.gegc.eventpay.features.webhook.application.WebhookLoggingContext;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIntentRouterImpl implements WebhookIntentRouter {

    static final String BUYER_FAVOUR_REFUND_REASON = "Dispute resolved in buyer's favour";

    private final OrderStateMachine orderStateMachine;
    private final SubscriptionStateMachine subscriptionStateMachine;
    private final DisputeTracker disputeTracker;
    private final SettlementReconciler settlementReconciler;
    private final AccountStatusService accountStatusService;

    @Override
    public RoutingOutcome route(WebhookProvider provider, WebhookIntent intent, WebhookLoggingContext context) {
        if (intent instanceof WebhookIntent.PaymentSucceeded succeeded) {
            return paymentSucceeded(provider, succeeded, context);
        }
        if (intent instanceof WebhookIntent.PaymentFailed failed) {
            return fromOrder(orderStateMachine.markFailed(failed.correlation(), failed.reason()),
                    context.withOrderId(failed.linkedOrderId()), "payment failure");
        }
        if (intent instanceof WebhookIntent.PaymentRefunded refunded) {
            return fromOrder(orderStateMachine.markRefunded(refunded.correlation(), refunded.amountCents(), refunded.reason()),
                    context.withOrderId(refunded.linkedOrderId()), "refund");
        }
        if (intent instanceof WebhookIntent.CheckoutApproved approved) {
            context.withOrderId(approved.linkedOrderId()).logInfo(log,
                    "PayPal order {} approved by buyer; waiting for capture", approved.correlation().paypalOrderId());
            return RoutingOutcome.NO_CHANGE;
        }
        if (intent instanceof WebhookIntent.DisputeOpened opened) {
            return disputeOpened(provider, opened, context.withDisputeId(opened.disputeId()));
        }
        if (intent instanceof WebhookIntent.DisputeResolved resolved) {
            return disputeResolved(resolved, context.withDisputeId(resolved.disputeId()));
        }
        if (intent instanceof WebhookIntent.SubscriptionLifecycle lifecycle) {
            return subscription(lifecycle, context.withSubscriptionId(lifecycle.subscriptionId()));
        }
        if (intent instanceof WebhookIntent.AccountStatusChanged account) {
            return accountStatusService.updateStatus(account).isPresent()
                    ? RoutingOutcome.APPLIED
                    : RoutingOutcome.UNMATCHED;
        }
        WebhookIntent.Ignored ignored = (WebhookIntent.Ignored) intent;
        context.logInfo(log, "Ignoring {} event: {}", provider.slug(), ignored.reason());
        return RoutingOutcome.NO_CHANGE;
    }

    private RoutingOutcome paymentSucceeded(WebhookProvider provider, WebhookIntent.PaymentSucceeded payment,
                                            WebhookLoggingContext context) {
        WebhookLoggingContext orderContext = context.withOrderId(payment.linkedOrderId());
        SettlementResult result = settlementReconciler.reconcile(provider, payment);
        return switch (result.outcome()) {
            case APPLIED -> {
                orderContext.logInfo(log, "Payment {} settled {}", payment.correlation().providerPaymentId(), result.targetId());
                yield RoutingOutcome.APPLIED;
            }
            case NOT_FOUND -> {
                orderContext.logWarn(log, "Payment {} ({} {}) matched nothing; manual reconciliation required",
                        payment.correlation().providerPaymentId(), payment.amountCents(), payment.currency());
                yield RoutingOutcome.UNMATCHED;
            }
            case ALREADY_APPLIED, REJECTED, SKIPPED -> RoutingOutcome.NO_CHANGE;
        };
    }

    private RoutingOutcome disputeOpened(WebhookProvider provider, WebhookIntent.DisputeOpened opened,
                                         WebhookLoggingContext context) {
        DisputeOpenResult result = disputeTracker.open(provider, opened);
        if (result.alreadyExists()) {
            context.logInfo(log, "Dispute {} already on file", opened.disputeId());
            return RoutingOutcome.NO_CHANGE;
        }
        context.logWarn(log, "Dispute {} opened for {} minor units ({}), response due {}",
                opened.disputeId(), opened.amountCents(), opened.reason(), opened.responseDeadline());
        return RoutingOutcome.APPLIED;
    }

    private RoutingOutcome disputeResolved(WebhookIntent.DisputeResolved resolved, WebhookLoggingContext context) {
        DisputeResolution resolution = disputeTracker.resolve(
                resolved.disputeId(), resolved.outcomeCode(), resolved.outcomeReason());
        if (resolution.outcome() == DisputeResolution.Outcome.NOT_FOUND) {
            return RoutingOutcome.UNMATCHED;
        }
        if (resolution.outcome() == DisputeResolution.Outcome.ALREADY_RESOLVED) {
            return RoutingOutcome.NO_CHANGE;
        }
        if (resolution.requiresOrderRefund()) {
            OrderTransitionResult refund = orderStateMachine.markRefunded(
                    resolution.orderId(), 0L, BUYER_FAVOUR_REFUND_REASON);
            context.withOrderId(resolution.orderId().toString()).logInfo(log,
                    "Dispute {} lost; order refund {}", resolved.disputeId(), refund.outcome());
        }
        return RoutingOutcome.APPLIED;
    }

    private RoutingOutcome subscription(WebhookIntent.SubscriptionLifecycle lifecycle, WebhookLoggingContext context) {
        SubscriptionTransitionResult result = subscriptionStateMachine.handleLifecycle(lifecycle);
        context.logInfo(log, "Subscription {} {}: {}", lifecycle.subscriptionId(), lifecycle.signal(), result.outcome());
        return switch (result.outcome()) {
            case CREATED, UPDATED -> RoutingOutcome.APPLIED;
            case NOT_FOUND -> RoutingOutcome.UNMATCHED;
            case ALREADY_IN_STATE, REJECTED, SKIPPED -> RoutingOutcome.NO_CHANGE;
        };
    }

    private RoutingOutcome fromOrder(OrderTransitionResult result, WebhookLoggingContext context, String what) {
        return switch (result.outcome()) {
            case APPLIED -> RoutingOutcome.APPLIED;
            case NOT_FOUND -> {
                context.logWarn(log, "No order matched {}; acknowledged without changes", what);
                yield RoutingOutcome.UNMATCHED;
            }
            case ALREADY_IN_STATE, REJECTED -> RoutingOutcome.NO_CHANGE;
        };
    }
}
