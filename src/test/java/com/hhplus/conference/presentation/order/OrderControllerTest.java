package com.hhplus.conference.presentation.order;

import com.hhplus.conference.application.order.OrderLedgerService;
import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.application.payment.PaymentService;
import com.hhplus.conference.application.payment.dto.PaymentIntentResponse;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.domain.order.IllegalOrderTransitionException;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderStatus;
import com.hhplus.conference.presentation.common.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * OrderControllerTest - 취소, 크레딧 적용, 결제 시작
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderController 단위 테스트")
class OrderControllerTest {

    private static final Long TEST_USER_ID = 100L;
    private static final Long TEST_ORDER_ID = 50L;

    private MockMvc mockMvc;

    @Mock
    private OrderLedgerService orderLedgerService;

    @Mock
    private PaymentService paymentService;

    @InjectMocks
    private OrderController orderController;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(orderController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private OrderResult result(OrderStatus status) {
        return OrderResult.builder()
                .orderId(TEST_ORDER_ID)
                .reference("ORD-AB12CD34")
                .status(status)
                .subtotal(new BigDecimal("160.00"))
                .discountAmount(BigDecimal.ZERO)
                .total(new BigDecimal("160.00"))
                .lineItems(List.of())
                .build();
    }

    @Test
    @DisplayName("주문 취소 - 성공")
    void testCancelOrder() throws Exception {
        when(orderLedgerService.cancelOrder(TEST_USER_ID, TEST_ORDER_ID)).thenReturn(result(OrderStatus.CANCELLED));

        mockMvc.perform(post("/orders/{order_id}/cancel", TEST_ORDER_ID)
                        .header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    @DisplayName("주문 취소 - PAID 주문은 허용되지 않은 전환")
    void testCancelOrder_Paid() throws Exception {
        when(orderLedgerService.cancelOrder(TEST_USER_ID, TEST_ORDER_ID))
                .thenThrow(new IllegalOrderTransitionException(TEST_ORDER_ID, OrderStatus.PAID, OrderStatus.CANCELLED));

        mockMvc.perform(post("/orders/{order_id}/cancel", TEST_ORDER_ID)
                        .header("X-USER-ID", TEST_USER_ID))
                .andExpect(jsonPath("$.error_code").value(ErrorCode.ILLEGAL_ORDER_TRANSITION.getCode()));
    }

    @Test
    @DisplayName("주문 없음 - 404")
    void testCancelOrder_NotFound() throws Exception {
        when(orderLedgerService.cancelOrder(TEST_USER_ID, TEST_ORDER_ID))
                .thenThrow(new OrderNotFoundException(TEST_ORDER_ID));

        mockMvc.perform(post("/orders/{order_id}/cancel", TEST_ORDER_ID)
                        .header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value(ErrorCode.ORDER_NOT_FOUND.getCode()));
    }

    @Test
    @DisplayName("크레딧 적용 - 전액 충당되면 PAID")
    void testApplyCredit() throws Exception {
        when(orderLedgerService.applyCredit(TEST_USER_ID, TEST_ORDER_ID, 3L)).thenReturn(result(OrderStatus.PAID));

        mockMvc.perform(post("/orders/{order_id}/credits/{credit_id}", TEST_ORDER_ID, 3L)
                        .header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAID"));
    }

    @Test
    @DisplayName("결제 시작 - client_secret 반환")
    void testInitiatePayment() throws Exception {
        when(paymentService.initiatePayment(TEST_USER_ID, TEST_ORDER_ID)).thenReturn(PaymentIntentResponse.builder()
                .orderId(TEST_ORDER_ID)
                .reference("ORD-AB12CD34")
                .paymentIntentId("pi_1")
                .clientSecret("pi_1_secret")
                .amount(new BigDecimal("160.00"))
                .currency("USD")
                .build());

        mockMvc.perform(post("/orders/{order_id}/payment-intent", TEST_ORDER_ID)
                        .header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payment_intent_id").value("pi_1"))
                .andExpect(jsonPath("$.client_secret").value("pi_1_secret"));
    }

    @Test
    @DisplayName("경로 변수 형식 오류 - 400")
    void testInvalidOrderId() throws Exception {
        mockMvc.perform(post("/orders/{order_id}/cancel", "abc")
                        .header("X-USER-ID", TEST_USER_ID))
                .andExpect(status().isBadRequest());
    }
}
