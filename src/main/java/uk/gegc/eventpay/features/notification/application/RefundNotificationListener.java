package uk.gegc.eventpay.features.notification.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.eventpay.features.order.domain.event.OrderRefundedEvent;
import uk.gegc.eventpay.features.order.domain.model.Order;
import uk.gegc.eventpay.features.order.infra.repository.OrderRepository;

import java.util.Locale;
import java.util.Optional;

/**
 * Emails the buyer once a refund has committed. Failures are logged and never reach the webhook.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefundNotificationListener {

    private final OrderRepository orderRepository;
    private final NotificationClient notificationClient;
    private final NotificationProperties properties;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderRefunded(OrderRefundedEvent event) {
        if (!properties.isEnabled()) {
            log.debug("Refund notifications disabled; skipping order {}", event.getOrderId());
            return;
        }
        try {
            Optional<Order> found = orderRepository.findById(event.getOrderId());
            if (found.isEmpty()) {
                log.warn("No order found for refund notification: {}", event.getOrderId());
                return;
            }
            Order order = found.get();
            if (order.getBuyerEmail() == null || order.getBuyerEmail().isBlank()) {
                log.warn("Order {} has no buyer email; refund notification skipped", order.getId());
                return;
            }

            boolean sent = notificationClient.sendRefundNotification(toNotification(order, event));
            if (sent) {
                log.info("Refund notification sent for order {}", order.getId());
            }
        } catch (Exception e) {
            log.warn("Failed to send refund notification for order {}: {}", event.getOrderId(), e.getMessage());
        }
    }

    private static RefundNotification toNotification(Order order, OrderRefundedEvent event) {
        String orderNumber = order.getOrderNumber() != null
                ? order.getOrderNumber()
                : order.getId().toString().substring(0, 12).toUpperCase(Locale.ROOT);
        return new RefundNotification(
                order.getBuyerEmail(),
                order.getBuyerName() != null ? order.getBuyerName() : "Valued Customer",
                order.getEventName() != null ? order.getEventName() : "Event",
                orderNumber,
                event.getRefundedAmountCents(),
                Math.max(1, order.getTicketCount()),
                event.getReason());
    }
}
