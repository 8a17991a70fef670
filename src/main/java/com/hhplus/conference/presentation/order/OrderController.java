package com.hhplus.conference.presentation.order;

import com.hhplus.conference.application.order.OrderLedgerService;
import com.hhplus.conference.application.payment.PaymentService;
import com.hhplus.conference.presentation.order.response.OrderResponse;
import com.hhplus.conference.presentation.order.response.PaymentIntentCreatedResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * OrderController - 주문 API 엔드포인트
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderLedgerService orderLedgerService;
    private final PaymentService paymentService;

    public OrderController(OrderLedgerService orderLedgerService, PaymentService paymentService) {
        this.orderLedgerService = orderLedgerService;
        this.paymentService = paymentService;
    }

    /**
     * POST /orders/{order_id}/cancel - PENDING 주문 취소
     */
    @PostMapping("/{order_id}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(orderLedgerService.cancelOrder(userId, orderId)));
    }

    /**
     * POST /orders/{order_id}/credits/{credit_id} - 크레딧 적용
     */
    @PostMapping("/{order_id}/credits/{credit_id}")
    public ResponseEntity<OrderResponse> applyCredit(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId,
            @PathVariable("credit_id") Long creditId) {
        return ResponseEntity.ok(OrderResponse.from(orderLedgerService.applyCredit(userId, orderId, creditId)));
    }

    /**
     * POST /orders/{order_id}/payment-intent - 남은 잔액으로 Stripe 결제 시작
     */
    @PostMapping("/{order_id}/payment-intent")
    public ResponseEntity<PaymentIntentCreatedResponse> initiatePayment(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(PaymentIntentCreatedResponse.from(paymentService.initiatePayment(userId, orderId)));
    }
}
