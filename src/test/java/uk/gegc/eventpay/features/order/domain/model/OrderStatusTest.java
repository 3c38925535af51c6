package uk.gegc.eventpay.features.order.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OrderStatus")
class OrderStatusTest {

    @Test
    @DisplayName("Pending moves anywhere forward")
    void pending() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.COMPLETED)).isTrue();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.FAILED)).isTrue();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.REFUNDED)).isTrue();
    }

    @Test
    @DisplayName("Completed can only be refunded")
    void completed() {
        assertThat(OrderStatus.COMPLETED.canTransitionTo(OrderStatus.REFUNDED)).isTrue();
        assertThat(OrderStatus.COMPLETED.canTransitionTo(OrderStatus.FAILED)).isFalse();
        assertThat(OrderStatus.COMPLETED.canTransitionTo(OrderStatus.PENDING)).isFalse();
        assertThat(OrderStatus.COMPLETED.isTerminal()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"FAILED", "REFUNDED"})
    @DisplayName("Failed and refunded are terminal")
    void terminal(OrderStatus status) {
        assertThat(status.isTerminal()).isTrue();
        for (OrderStatus target : OrderStatus.values()) {
            assertThat(status.canTransitionTo(target)).isFalse();
        }
    }
}
