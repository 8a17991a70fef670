package com.hhplus.conference.presentation.admin;

import com.hhplus.conference.application.payment.PaymentRecordService;
import com.hhplus.conference.presentation.order.request.ManualPaymentRequest;
import com.hhplus.conference.presentation.order.response.OrderResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 운영자 결제 입력 API (인증은 앞단 게이트웨이에서 처리)
 */
@RestController
@RequestMapping("/admin/orders/{order_id}/payments")
public class AdminPaymentController {

    private final PaymentRecordService paymentRecordService;

    public AdminPaymentController(PaymentRecordService paymentRecordService) {
        this.paymentRecordService = paymentRecordService;
    }

    /**
     * POST /admin/orders/{order_id}/payments/comp - 총액 0 주문 확정
     */
    @PostMapping("/comp")
    public ResponseEntity<OrderResponse> recordComp(@PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(OrderResponse.from(paymentRecordService.recordComp(orderId)));
    }

    /**
     * POST /admin/orders/{order_id}/payments/manual
     */
    @PostMapping("/manual")
    public ResponseEntity<OrderResponse> recordManual(
            @PathVariable("order_id") Long orderId,
            @Valid @RequestBody ManualPaymentRequest request) {
        return ResponseEntity.ok(OrderResponse.from(paymentRecordService.recordManual(
                orderId, request.getAmount(), request.getReference(), request.getNote())));
    }
}
