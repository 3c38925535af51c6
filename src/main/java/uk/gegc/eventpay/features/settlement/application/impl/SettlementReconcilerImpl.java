package uk.gegc.eventpay.features.settlement.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.eventpay.features.order.application.OrderStateMachine;
import uk.gegc.eventpay.features.order.application.OrderTransitionResult;
import uk.gegc.eventpay.features.order.domain.model.PaymentMethod;
import uk.gegc.eventpay.features.settlement.application.CreditPurchase;
import uk.gegc.eventpay.features.settlement.application.PlatformProductService;
import uk.gegc.eventpay.features.settlement.application.PromotionActivationResult;
import uk.gegc.eventpay.features.settlement.application.SettlementReconciler;
import uk.gegc.eventpay.features.settlement.application.SettlementResult;
import uk.gegc.eventpay.features.settlement.domain.model.*;
import uk.gegc.eventpay.features.settlement.infra.repository.*;
import uk.gegc.eventpay.features.subscription.application.SubscriptionActivation;
import uk.gegc.eventpay.features.subscription.application.SubscriptionStateMachine;
import uk.gegc.eventpay.features.subscription.application.SubscriptionTransitionResult;
import uk.gegc.eventpay.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.eventpay.features.webhook.application.classification.PaymentPurpose;
import uk.gegc.eventpay.features.webhook.application.classification.WebhookIntent;
import uk.gegc.eventpay.features.webhook.domain.model.WebhookProvider;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
public class SettlementReconcilerImpl implements SettlementReconciler {

    private final OrderStateMachine orderStateMachine;
    private final SubscriptionStateMachine subscriptionStateMachine;
    private final PlatformProductService platformProductService;
    private final ProductOrderRepository productOrderRepository;
    private final FoodOrderRepository foodOrderRepository;
    private final VendorRepository vendorRepository;
    private final VendorEarningsRepository vendorEarningsRepository;
    private final OrganizerPlatformDebtRepository platformDebtRepository;
    private final PlatformDebtSettlementRepository debtSettlementRepository;
    private final TransactionTemplate enrichmentTransaction;
    private final Clock clock;

    public SettlementReconcilerImpl(OrderStateMachine orderStateMachine,
                                    SubscriptionStateMachine subscriptionStateMachine,
                                    PlatformProductService platformProductService,
                                    ProductOrderRepository productOrderRepository,
                                    FoodOrderRepository foodOrderRepository,
                                    VendorRepository vendorRepository,
                                    VendorEarningsRepository vendorEarningsRepository,
                                    OrganizerPlatformDebtRepository platformDebtRepository,
                                    PlatformDebtSettlementRepository debtSettlementRepository,
                                    TransactionTemplate transactionTemplate,
                                    Clock clock) {
        this.orderStateMachine = orderStateMachine;
        this.subscriptionStateMachine = subscriptionStateMachine;
        this.platformProductService = platformProductService;
        this.productOrderRepository = productOrderRepository;
        this.foodOrderRepository = foodOrderRepository;
        this.vendorRepository = vendorRepository;
        this.vendorEarningsRepository = vendorEarningsRepository;
        this.platformDebtRepository = platformDebtRepository;
        this.debtSettlementRepository = debtSettlementRepository;
        this.enrichmentTransaction = new TransactionTemplate(transactionTemplate.getTransactionManager());
        this.enrichmentTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    @Transactional
    public SettlementResult reconcile(WebhookProvider provider, WebhookIntent.PaymentSucceeded payment) {
        PaymentPurpose purpose = payment.purpose();
        if (purpose instanceof PaymentPurpose.TicketOrder ticket) {
            return settleTicketOrder(provider, payment, ticket);
        }
        if (purpose instanceof PaymentPurpose.ProductOrder product) {
            return settleProductOrder(provider, payment, product);
        }
        if (purpose instanceof PaymentPurpose.FoodOrder food) {
            return settleFoodOrder(provider, payment, food);
        }
        return settlePlatformProduct(payment, (PaymentPurpose.PlatformProduct) purpose);
    }

    private SettlementResult settleTicketOrder(WebhookProvider provider, WebhookIntent.PaymentSucceeded payment,
                                               PaymentPurpose.TicketOrder ticket) {
        PaymentMethod method = provider == WebhookProvider.PAYPAL ? PaymentMethod.PAYPAL : PaymentMethod.STRIPE;
        OrderTransitionResult result = orderStateMachine.markPaid(payment.correlation(), method);

        if (result.outcome() == OrderTransitionResult.Outcome.NOT_FOUND) {
            return SettlementResult.notFound();
        }
        if (result.outcome() == OrderTransitionResult.Outcome.REJECTED) {
            return SettlementResult.rejected(result.orderId());
        }

        if (ticket.settlementAmountCents() > 0 && ticket.organizerId() != null) {
            String orderId = result.orderId().toString();
            runEnrichment("platform debt settlement for order " + orderId,
                    () -> recordDebtSettlement(ticket.organizerId(), orderId, ticket.eventId(), ticket.settlementAmountCents()));
        }
        return result.isApplied()
                ? SettlementResult.applied(result.orderId())
                : SettlementResult.alreadyApplied(result.orderId());
    }

    private SettlementResult settleProductOrder(WebhookProvider provider, WebhookIntent.PaymentSucceeded payment,
                                                PaymentPurpose.ProductOrder product) {
        Optional<UUID> orderId = parseId(product.orderId(), "product order");
        Optional<ProductOrder> found = orderId.flatMap(productOrderRepository::findByIdForUpdate);
        if (found.isEmpty()) {
            log.warn("Product order payment {} does not match a stored product order ({})",
                    payment.correlation().providerPaymentId(), product.orderId());
            return SettlementResult.notFound();
        }

        ProductOrder order = found.get();
        if (order.getPaymentStatus() == MerchandisePaymentStatus.PAID) {
            log.info("Product order {} already paid", order.getId());
            return SettlementResult.alreadyApplied(order.getId());
        }
        if (order.getPaymentStatus() != MerchandisePaymentStatus.PENDING) {
            log.warn("Refusing to mark product order {} paid: payment status is {}", order.getId(), order.getPaymentStatus());
            return SettlementResult.rejected(order.getId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.setPaymentStatus(MerchandisePaymentStatus.PAID);
        order.setPaymentProvider(provider);
        order.setProviderPaymentId(payment.correlation().providerPaymentId());
        order.setPaidAt(now);
        order.setUpdatedAt(now);
        productOrderRepository.save(order);
        log.info("Product order {} marked PAID", order.getId());

        UUID vendorId = parseId(product.vendorId(), "vendor").orElse(order.getVendorId());
        if (vendorId != null) {
            UUID productOrderId = order.getId();
            String orderNumber = order.getOrderNumber();
            long subtotal = order.getSubtotalCents();
            runEnrichment("vendor earnings for product order " + productOrderId,
                    () -> recordVendorEarnings(vendorId, productOrderId, orderNumber, subtotal, product.commissionPercent()));
            long vendorShare = payment.amountCents() - product.applicationFeeCents();
            runEnrichment("vendor stats for vendor " + vendorId,
                    () -> updateVendorStats(vendorId, vendorShare));
        }
        return SettlementResult.applied(order.getId());
    }

    private SettlementResult settleFoodOrder(WebhookProvider provider, WebhookIntent.PaymentSucceeded payment,
                                             PaymentPurpose.FoodOrder food) {
        Optional<FoodOrder> found = parseId(food.orderId(), "food order").flatMap(foodOrderRepository::findByIdForUpdate);
        if (found.isEmpty()) {
            log.warn("Food order payment {} does not match a stored food order ({})",
                    payment.correlation().providerPaymentId(), food.orderId());
            return SettlementResult.notFound();
        }

        FoodOrder order = found.get();
        if (order.getPaymentStatus() == MerchandisePaymentStatus.PAID) {
            log.info("Food order {} already paid", order.getId());
            return SettlementResult.alreadyApplied(order.getId());
        }
        if (order.getPaymentStatus() != MerchandisePaymentStatus.PENDING) {
            log.warn("Refusing to mark food order {} paid: payment status is {}", order.getId(), order.getPaymentStatus());
            return SettlementResult.rejected(order.getId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.setPaymentStatus(MerchandisePaymentStatus.PAID);
        order.setPaymentProvider(provider);
        order.setProviderPaymentId(payment.correlation().providerPaymentId());
        order.setPaidAt(now);
        order.setUpdatedAt(now);
        foodOrderRepository.save(order);

        log.info("Food order {} marked PAID", order.getId());
        return SettlementResult.applied(order.getId());
    }

    private SettlementResult settlePlatformProduct(WebhookIntent.PaymentSucceeded payment,
                                                   PaymentPurpose.PlatformProduct product) {
        if (product.userId() == null) {
            log.warn("Platform {} payment {} carries no userId", product.productType(),
                    payment.correlation().providerPaymentId());
            return SettlementResult.notFound();
        }
        String paymentReference = payment.correlation().providerPaymentId();

        return switch (product.productType()) {
            case CREDITS -> confirmCredits(payment, product, paymentReference);
            case SUBSCRIPTION -> activateSubscription(payment, product);
            case PROMOTION -> activatePromotion(payment, product, paymentReference);
            case PREMIUM_FEATURE -> {
                log.info("Premium feature purchase {} for user {} recorded; no activation available",
                        paymentReference, product.userId());
                yield SettlementResult.skipped();
            }
        };
    }

    private SettlementResult confirmCredits(WebhookIntent.PaymentSucceeded payment,
                                            PaymentPurpose.PlatformProduct product, String paymentReference) {
        var result = platformProductService.confirmCreditPurchase(new CreditPurchase(
                product.userId(), paymentReference, product.ticketQuantity(),
                payment.amountCents(), product.pricePerTicketCents()));
        return result.alreadyCompleted()
                ? SettlementResult.alreadyApplied(paymentReference)
                : SettlementResult.applied(paymentReference);
    }

    private SettlementResult activateSubscription(WebhookIntent.PaymentSucceeded payment,
                                                  PaymentPurpose.PlatformProduct product) {
        SubscriptionTransitionResult result = subscriptionStateMachine.activate(new SubscriptionActivation(
                product.userId(),
                SubscriptionPlan.fromMetadata(product.subscriptionPlan()),
                product.stripeSubscriptionId(),
                product.stripeCustomerId(),
                product.stripePriceId(),
                "active",
                payment.amountCents()));
        return result.isChanged()
                ? SettlementResult.applied(result.subscriptionId())
                : SettlementResult.rejected(result.subscriptionId());
    }

    private SettlementResult activatePromotion(WebhookIntent.PaymentSucceeded payment,
                                               PaymentPurpose.PlatformProduct product, String paymentReference) {
        if (product.eventId() == null) {
            log.warn("Promotion payment {} is missing eventId", paymentReference);
            return SettlementResult.notFound();
        }
        var result = platformProductService.activatePromotion(product.eventId(), product.userId(),
                PromotionType.fromMetadata(product.promotionType()), paymentReference, payment.amountCents());
        return result.outcome() == PromotionActivationResult.Outcome.ALREADY_ACTIVE
                ? SettlementResult.alreadyApplied(result.promotionId())
                : SettlementResult.applied(result.promotionId());
    }

    private void recordDebtSettlement(String organizerId, String orderId, String eventId, long amountCents) {
        if (debtSettlementRepository.existsByOrderId(orderId)) {
            log.info("Platform debt settlement for order {} already recorded", orderId);
            return;
        }
        Optional<OrganizerPlatformDebt> found = platformDebtRepository.findByOrganizerId(organizerId);
        if (found.isEmpty()) {
            log.warn("No platform debt record for organizer {}; settlement of {} cents from order {} not applied",
                    organizerId, amountCents, orderId);
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        OrganizerPlatformDebt debt = found.get();
        long remaining = debt.settle(amountCents, now);
        platformDebtRepository.save(debt);
        debtSettlementRepository.save(new PlatformDebtSettlement(organizerId, orderId, eventId, amountCents, remaining, now));

        log.info("Recorded platform debt settlement for organizer {}: {} cents, {} cents remaining",
                organizerId, amountCents, remaining);
    }

    private void recordVendorEarnings(UUID vendorId, UUID productOrderId, String orderNumber,
                                      long grossAmountCents, int commissionRate) {
        if (vendorEarningsRepository.existsByProductOrderId(productOrderId)) {
            log.info("Vendor earnings for product order {} already recorded", productOrderId);
            return;
        }
        long commission = commissionCents(grossAmountCents, commissionRate);
        vendorEarningsRepository.save(new VendorEarnings(vendorId, productOrderId, orderNumber,
                grossAmountCents, commissionRate, commission, LocalDateTime.now(clock)));
        log.info("Vendor earnings created for product order {}: gross {}, commission {}",
                productOrderId, grossAmountCents, commission);
    }

    private void updateVendorStats(UUID vendorId, long amountCents) {
        Vendor vendor = vendorRepository.findByIdForUpdate(vendorId)
                .orElseThrow(() -> new IllegalStateException("Vendor not found: " + vendorId));
        vendor.setTotalSalesCents(vendor.getTotalSalesCents() + amountCents);
        vendor.setTotalEarningsCents(vendor.getTotalEarningsCents() + amountCents);
        vendor.setUpdatedAt(LocalDateTime.now(clock));
        vendorRepository.save(vendor);
        log.info("Vendor stats updated for {}: +{} cents", vendorId, amountCents);
    }

    /**
     * Platform commission on a subtotal, rounded half-up to the nearest minor unit.
     */
    static long commissionCents(long grossAmountCents, int commissionRate) {
        return BigDecimal.valueOf(grossAmountCents)
                .multiply(BigDecimal.valueOf(commissionRate))
                .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    private void runEnrichment(String description, Runnable step) {
        try {
            enrichmentTransaction.executeWithoutResult(status -> step.run());
        } catch (Exception e) {
            // The primary update stands; the step can be replayed from the logs
            log.error("Failed to record {}: {}", description, e.getMessage(), e);
        }
    }

    private Optional<UUID> parseId(String value, String kind) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} id '{}' in payment metadata", kind, value);
            return Optional.empty();
        }
    }
}
