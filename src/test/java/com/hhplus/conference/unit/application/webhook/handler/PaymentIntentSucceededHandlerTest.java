package com.hhplus.conference.unit.application.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.conference.application.order.OrderSettlementService;
import com.hhplus.conference.application.webhook.handler.PaymentIntentSucceededHandler;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.order.IllegalOrderTransitionException;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderPaidNotifier;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.order.OrderStatus;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.payment.PaymentStatus;
import com.hhplus.conference.domain.webhook.StripeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * PaymentIntentSucceededHandlerTest - payment_intent.succeeded 처리
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentIntentSucceededHandler 단위 테스트")
class PaymentIntentSucceededHandlerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);
    private static final Long ORDER_ID = 50L;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private OrderPaidNotifier orderPaidNotifier;

    private PaymentIntentSucceededHandler handler;
    private final StripeEvent event = StripeEvent.builder().eventId(1L).stripeId("evt_1").build();

    @BeforeEach
    void setup() {
        handler = new PaymentIntentSucceededHandler(orderRepository, paymentRepository,
                new OrderSettlementService(orderRepository, paymentRepository, orderPaidNotifier),
                new RegistrationProperties(),
                Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private JsonNode intent(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    private Order order(OrderStatus status) {
        return Order.builder()
                .orderId(ORDER_ID)
                .userId(100L)
                .conferenceId(1L)
                .reference("ORD-TEST0001")
                .status(status)
                .total(new BigDecimal("160.00"))
                .holdExpiresAt(NOW.plusMinutes(10))
                .build();
    }

    @Test
    @DisplayName("PENDING 결제를 SUCCEEDED 로 바꾸고 주문은 PAID, 보류 해제")
    void testSucceeded_PendingOrder() throws Exception {
        // Given
        Order order = order(OrderStatus.PENDING);
        Payment pending = Payment.pendingStripe(ORDER_ID, new BigDecimal("160.00"), "pi_1", NOW.minusMinutes(3));
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(paymentRepository.findByPaymentIntentIdForUpdate("pi_1")).thenReturn(Optional.of(pending));

        // When
        handler.processEvent(event, intent("{\"id\":\"pi_1\",\"amount\":16000,\"currency\":\"usd\","
                + "\"latest_charge\":\"ch_1\",\"metadata\":{\"order_id\":\"50\"}}"));

        // Then
        assertEquals(PaymentStatus.SUCCEEDED, pending.getStatus());
        assertEquals(new BigDecimal("160.00"), pending.getAmount());
        assertEquals("ch_1", pending.getStripeChargeId());
        assertEquals(OrderStatus.PAID, order.getStatus());
        assertNull(order.getHoldExpiresAt());
        verify(orderPaidNotifier).notifyPaid(order);
    }

    @Test
    @DisplayName("기록된 결제가 없으면 SUCCEEDED 결제를 새로 만든다 (확장된 latest_charge 객체)")
    void testSucceeded_CreatesPayment() throws Exception {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(paymentRepository.findByPaymentIntentIdForUpdate("pi_2")).thenReturn(Optional.empty());

        handler.processEvent(event, intent("{\"id\":\"pi_2\",\"amount\":16000,"
                + "\"latest_charge\":{\"id\":\"ch_2\"},\"metadata\":{\"order_id\":\"50\"}}"));

        ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(captor.capture());
        assertEquals(PaymentStatus.SUCCEEDED, captor.getValue().getStatus());
        assertEquals("ch_2", captor.getValue().getStripeChargeId());
        assertEquals(ORDER_ID, captor.getValue().getOrderId());
    }

    @Test
    @DisplayName("0 소수 통화는 최소 단위 그대로 금액")
    void testSucceeded_ZeroDecimalCurrency() throws Exception {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING)));
        when(paymentRepository.findByPaymentIntentIdForUpdate("pi_3")).thenReturn(Optional.empty());

        handler.processEvent(event, intent("{\"id\":\"pi_3\",\"amount\":5000,\"currency\":\"jpy\","
                + "\"metadata\":{\"order_id\":\"50\"}}"));

        ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(captor.capture());
        assertEquals(0, new BigDecimal("5000").compareTo(captor.getValue().getAmount()));
    }

    @Test
    @DisplayName("이미 PAID 인 주문은 다시 전환하지 않고 알림도 보내지 않음")
    void testSucceeded_AlreadyPaid() throws Exception {
        Order paid = order(OrderStatus.PAID);
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(paid));
        when(paymentRepository.findByPaymentIntentIdForUpdate("pi_1")).thenReturn(Optional.empty());

        handler.processEvent(event, intent("{\"id\":\"pi_1\",\"amount\":16000,\"metadata\":{\"order_id\":\"50\"}}"));

        assertEquals(OrderStatus.PAID, paid.getStatus());
        verifyNoInteractions(orderPaidNotifier);
    }

    @Test
    @DisplayName("CANCELLED 주문에 결제 성공이 오면 허용되지 않은 전환")
    void testSucceeded_CancelledOrder() throws Exception {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.CANCELLED)));
        when(paymentRepository.findByPaymentIntentIdForUpdate("pi_1")).thenReturn(Optional.empty());
        JsonNode body = intent("{\"id\":\"pi_1\",\"amount\":16000,\"metadata\":{\"order_id\":\"50\"}}");

        assertThrows(IllegalOrderTransitionException.class, () -> handler.processEvent(event, body));
    }

    @Test
    @DisplayName("metadata.order_id 가 없으면 예외")
    void testSucceeded_MissingOrderId() throws Exception {
        JsonNode body = intent("{\"id\":\"pi_1\",\"amount\":16000,\"metadata\":{}}");

        assertThrows(IllegalArgumentException.class, () -> handler.processEvent(event, body));
        verifyNoInteractions(orderRepository, paymentRepository);
    }

    @Test
    @DisplayName("주문이 없으면 예외")
    void testSucceeded_UnknownOrder() throws Exception {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.empty());
        JsonNode body = intent("{\"id\":\"pi_1\",\"amount\":16000,\"metadata\":{\"order_id\":\"50\"}}");

        assertThrows(OrderNotFoundException.class, () -> handler.processEvent(event, body));
        verify(paymentRepository, never()).save(any());
    }
}
