package uk.gegc.eventpay.features.notification.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.eventpay.features.order.domain.event.OrderRefundedEvent;
import uk.gegc.eventpay.features.order.domain.model.Order;
import uk.gegc.eventpay.features.order.infra.repository.OrderRepository;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RefundNotificationListener")
class RefundNotificationListenerTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private NotificationClient notificationClient;

    private NotificationProperties properties;
    private RefundNotificationListener listener;

    @BeforeEach
    void setUp() {
        properties = new NotificationProperties();
        listener = new RefundNotificationListener(orderRepository, notificationClient, properties);
    }

    private static Order order(UUID id) {
        Order order = new Order();
        order.setId(id);
        order.setBuyerEmail("buyer@example.com");
        order.setTicketCount(2);
        return order;
    }

    @Test
    @DisplayName("Sends the notification with defaults for missing order details")
    void sendsWithDefaults() {
        UUID orderId = UUID.fromString("0a1b2c3d-4e5f-6789-abcd-ef0123456789");
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(orderId)));
        when(notificationClient.sendRefundNotification(any())).thenReturn(true);

        listener.handleOrderRefunded(new OrderRefundedEvent(this, orderId, 5000L, "requested_by_customer"));

        ArgumentCaptor<RefundNotification> sent = ArgumentCaptor.forClass(RefundNotification.class);
        verify(notificationClient).sendRefundNotification(sent.capture());
        RefundNotification notification = sent.getValue();
        assertThat(notification.email()).isEqualTo("buyer@example.com");
        assertThat(notification.customerName()).isEqualTo("Valued Customer");
        assertThat(notification.eventName()).isEqualTo("Event");
        assertThat(notification.orderNumber()).isEqualTo("0A1B2C3D-4E5");
        assertThat(notification.ticketCount()).isEqualTo(2);
        assertThat(notification.refundReason()).isEqualTo("requested_by_customer");
    }

    @Test
    @DisplayName("Order without an email is skipped")
    void noEmail_skipped() {
        UUID orderId = UUID.randomUUID();
        Order order = order(orderId);
        order.setBuyerEmail(" ");
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order));

        listener.handleOrderRefunded(new OrderRefundedEvent(this, orderId, 5000L, "x"));

        verify(notificationClient, never()).sendRefundNotification(any());
    }

    @Test
    @DisplayName("Disabled notifications do not touch the store")
    void disabled_skipped() {
        properties.setEnabled(false);

        listener.handleOrderRefunded(new OrderRefundedEvent(this, UUID.randomUUID(), 5000L, "x"));

        verifyNoInteractions(orderRepository, notificationClient);
    }

    @Test
    @DisplayName("Client failure is contained")
    void clientFailure_contained() {
        UUID orderId = UUID.randomUUID();
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order(orderId)));
        when(notificationClient.sendRefundNotification(any())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> listener.handleOrderRefunded(new OrderRefundedEvent(this, orderId, 5000L, "x")))
                .doesNotThrowAnyException();
    }
}
