package uk.gegc.eventpay.features.order.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.eventpay.features.order.application.OrderStateMachine;
import uk.gegc.eventpay.features.order.application.OrderTransitionResult;
import uk.gegc.eventpay.features.order.domain.event.OrderRefundedEvent;
import uk.gegc.eventpay.features.order.domain.model.Order;
import uk.gegc.eventpay.features.order.domain.model.OrderStatus;
import uk.gegc.eventpay.features.order.domain.model.PaymentMethod;
import uk.gegc.eventpay.features.order.infra.repository.OrderRepository;
import uk.gegc.eventpay.features.webhook.application.classification.PaymentCorrelation;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStateMachineImpl implements OrderStateMachine {

    private final OrderRepository orderRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public OrderTransitionResult markPaid(PaymentCorrelation correlation, PaymentMethod paymentMethod) {
        Optional<Order> found = findByOrderId(correlation.orderId()).or(() -> findByNativeIds(correlation));
        if (found.isEmpty()) {
            log.warn("Payment succeeded for unknown order (orderId={}, paymentIntent={}, paypalOrder={}, capture={})",
                    correlation.orderId(), correlation.stripePaymentIntentId(),
                    correlation.paypalOrderId(), correlation.paypalCaptureId());
            return OrderTransitionResult.notFound();
        }

        Order order = found.get();
        if (order.getStatus() == OrderStatus.COMPLETED) {
            log.info("Order {} already paid", order.getId());
            return OrderTransitionResult.alreadyInState(order.getId(), order.getStatus());
        }
        if (!order.getStatus().canTransitionTo(OrderStatus.COMPLETED)) {
            log.warn("Refusing to mark order {} paid: order is {} (manual reconciliation required)",
                    order.getId(), order.getStatus());
            return OrderTransitionResult.rejected(order.getId(), order.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.setStatus(OrderStatus.COMPLETED);
        order.setPaymentMethod(paymentMethod);
        order.setPaidAt(now);
        order.setUpdatedAt(now);
        if (correlation.stripePaymentIntentId() != null) {
            order.setStripePaymentIntentId(correlation.stripePaymentIntentId());
        }
        if (correlation.paypalCaptureId() != null) {
            order.setPaypalCaptureId(correlation.paypalCaptureId());
        }
        if (correlation.paypalOrderId() != null && order.getPaypalOrderId() == null) {
            order.setPaypalOrderId(correlation.paypalOrderId());
        }
        orderRepository.save(order);

        log.info("Order {} marked COMPLETED via {} ({})", order.getId(), paymentMethod, correlation.providerPaymentId());
        return OrderTransitionResult.applied(order.getId(), OrderStatus.COMPLETED);
    }

    @Override
    @Transactional
    public OrderTransitionResult markFailed(PaymentCorrelation correlation, String reason) {
        Optional<Order> found = findByOrderId(correlation.orderId()).or(() -> findByNativeIds(correlation));
        if (found.isEmpty()) {
            log.warn("Payment failure for unknown order (orderId={}, paymentIntent={}, paypalOrder={})",
                    correlation.orderId(), correlation.stripePaymentIntentId(), correlation.paypalOrderId());
            return OrderTransitionResult.notFound();
        }

        Order order = found.get();
        if (order.getStatus() == OrderStatus.FAILED) {
            log.info("Order {} already failed", order.getId());
            return OrderTransitionResult.alreadyInState(order.getId(), order.getStatus());
        }
        if (!order.getStatus().canTransitionTo(OrderStatus.FAILED)) {
            log.warn("Ignoring payment failure for order {}: order is already {}", order.getId(), order.getStatus());
            return OrderTransitionResult.rejected(order.getId(), order.getStatus());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        order.setStatus(OrderStatus.FAILED);
        order.setFailureReason(reason);
        order.setFailedAt(now);
        order.setUpdatedAt(now);
        orderRepository.save(order);

        log.info("Order {} marked FAILED: {}", order.getId(), reason);
        return OrderTransitionResult.applied(order.getId(), OrderStatus.FAILED);
    }

    @Override
    @Transactional
    public OrderTransitionResult markRefunded(PaymentCorrelation correlation, long refundedAmountCents, String reason) {
        if (correlation.isEmpty()) {
            log.warn("Refund is unprocessable: no provider id and no order id (manual reconciliation required)");
            return OrderTransitionResult.notFound();
        }

        Optional<Order> found = findByNativeIds(correlation).or(() -> findByOrderId(correlation.orderId()));
        if (found.isEmpty()) {
            log.warn("Refund for unknown order (paymentIntent={}, paypalOrder={}, capture={}, orderId={}); manual reconciliation required",
                    correlation.stripePaymentIntentId(), correlation.paypalOrderId(),
                    correlation.paypalCaptureId(), correlation.orderId());
            return OrderTransitionResult.notFound();
        }
        return applyRefund(found.get(), refundedAmountCents, reason);
    }

    @Override
    @Transactional
    public OrderTransitionResult markRefunded(UUID orderId, long refundedAmountCents, String reason) {
        return orderRepository.findByIdForUpdate(orderId)
                .map(order -> applyRefund(order, refundedAmountCents, reason))
                .orElseGet(() -> {
                    log.warn("Refund for unknown order {}", orderId);
                    return OrderTransitionResult.notFound();
                });
    }

    private OrderTransitionResult applyRefund(Order order, long refundedAmountCents, String reason) {
        if (order.getStatus() == OrderStatus.REFUNDED) {
            log.info("Order {} already refunded", order.getId());
            return OrderTransitionResult.alreadyInState(order.getId(), order.getStatus());
        }
        if (!order.getStatus().canTransitionTo(OrderStatus.REFUNDED)) {
            log.warn("Refusing to refund order {}: order is {}", order.getId(), order.getStatus());
            return OrderTransitionResult.rejected(order.getId(), order.getStatus());
        }
        if (order.getStatus() == OrderStatus.PENDING) {
            log.warn("Refund observed before payment success for order {}; moving PENDING → REFUNDED", order.getId());
        }

        long amount = refundedAmountCents > 0 ? refundedAmountCents : order.getTotalCents();
        LocalDateTime now = LocalDateTime.now(clock);
        order.setStatus(OrderStatus.REFUNDED);
        order.setRefundedAmountCents(amount);
        order.setRefundReason(reason);
        order.setRefundedAt(now);
        order.setUpdatedAt(now);
        orderRepository.save(order);

        eventPublisher.publishEvent(new OrderRefundedEvent(this, order.getId(), amount, reason));
        log.info("Order {} marked REFUNDED ({} cents): {}", order.getId(), amount, reason);
        return OrderTransitionResult.applied(order.getId(), OrderStatus.REFUNDED);
    }

    private Optional<Order> findByOrderId(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        UUID id;
        try {
            id = UUID.fromString(orderId);
        } catch (IllegalArgumentException e) {
            log.warn("Order id '{}' from payment metadata is not a valid id", orderId);
            return Optional.empty();
        }
        return orderRepository.findByIdForUpdate(id);
    }

    private Optional<Order> findByNativeIds(PaymentCorrelation correlation) {
        Optional<Order> order = Optional.empty();
        if (correlation.stripePaymentIntentId() != null) {
            order = orderRepository.findFirstByStripePaymentIntentIdOrderByCreatedAtAsc(correlation.stripePaymentIntentId());
        }
        if (order.isEmpty() && correlation.paypalOrderId() != null) {
            order = orderRepository.findFirstByPaypalOrderIdOrderByCreatedAtAsc(correlation.paypalOrderId());
        }
        if (order.isEmpty() && correlation.paypalCaptureId() != null) {
            order = orderRepository.findFirstByPaypalCaptureIdOrderByCreatedAtAsc(correlation.paypalCaptureId());
        }
        return order;
    }
}
