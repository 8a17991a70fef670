package com.hhplus.conference.unit.domain.order;

import com.hhplus.conference.domain.order.IllegalOrderTransitionException;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderTest - 주문 상태 기계 단위 테스트
 *
 * 허용 전환: PENDING → PAID | CANCELLED, PAID → REFUNDED | PARTIALLY_REFUNDED
 */
@DisplayName("Order 상태 전환 테스트")
class OrderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);

    private Order pendingOrder() {
        return Order.createPending(1L, 100L, "ORD-ABCD1234",
                new BigDecimal("200.00"), new BigDecimal("40.00"),
                "EARLY", "PERCENTAGE:20.00", NOW.plusMinutes(15), NOW);
    }

    @Test
    @DisplayName("PENDING 주문 생성 - total = subtotal − discount")
    void testCreatePending() {
        Order order = pendingOrder();

        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertEquals(new BigDecimal("160.00"), order.getTotal());
        assertTrue(order.isHoldActive(NOW));
        assertFalse(order.isHoldActive(NOW.plusMinutes(15)));
    }

    @Test
    @DisplayName("할인이 소계를 넘으면 생성 거부")
    void testCreatePendingRejectsNegativeTotal() {
        assertThrows(IllegalArgumentException.class, () -> Order.createPending(1L, 100L, "ORD-X",
                new BigDecimal("10.00"), new BigDecimal("10.01"), null, null, NOW, NOW));
    }

    @Test
    @DisplayName("PAID 전환 시 보류 해제")
    void testMarkPaidClearsHold() {
        Order order = pendingOrder();

        order.markPaid(NOW);

        assertEquals(OrderStatus.PAID, order.getStatus());
        assertNull(order.getHoldExpiresAt());
        assertFalse(order.isHoldActive(NOW));
    }

    @Test
    @DisplayName("PAID → PARTIALLY_REFUNDED 허용, 이후 REFUNDED 는 거부")
    void testPartialRefundIsTerminal() {
        Order order = pendingOrder();
        order.markPaid(NOW);

        order.markPartiallyRefunded(NOW);

        assertEquals(OrderStatus.PARTIALLY_REFUNDED, order.getStatus());
        assertThrows(IllegalOrderTransitionException.class, () -> order.markRefunded(NOW));
        assertEquals(OrderStatus.PARTIALLY_REFUNDED, order.getStatus());
    }

    @Test
    @DisplayName("PENDING → REFUNDED 거부, 상태 변경 없음")
    void testPendingCannotBeRefunded() {
        Order order = pendingOrder();

        assertThrows(IllegalOrderTransitionException.class, () -> order.markRefunded(NOW));
        assertEquals(OrderStatus.PENDING, order.getStatus());
    }

    @Test
    @DisplayName("PAID 주문은 취소할 수 없다")
    void testPaidCannotBeCancelled() {
        Order order = pendingOrder();
        order.markPaid(NOW);

        assertThrows(IllegalOrderTransitionException.class, () -> order.cancel(NOW));
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"REFUNDED", "PARTIALLY_REFUNDED", "CANCELLED"})
    @DisplayName("종료 상태에서는 어떤 전환도 허용되지 않는다")
    void testTerminalStates(OrderStatus terminal) {
        for (OrderStatus target : OrderStatus.values()) {
            assertFalse(terminal.canTransitionTo(target), terminal + " → " + target);
        }
    }
}
