package com.hhplus.conference.presentation.checkout;

import com.hhplus.conference.application.checkout.CheckoutService;
import com.hhplus.conference.application.checkout.dto.CheckoutCommand;
import com.hhplus.conference.presentation.checkout.request.CheckoutRequest;
import com.hhplus.conference.presentation.order.response.OrderResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CheckoutController - 장바구니를 PENDING 주문으로 전환
 */
@RestController
@RequestMapping("/conferences/{slug}/checkout")
public class CheckoutController {

    private final CheckoutService checkoutService;

    public CheckoutController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    /**
     * POST /conferences/{slug}/checkout
     */
    @PostMapping
    public ResponseEntity<OrderResponse> checkout(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug,
            @RequestBody(required = false) CheckoutRequest request) {
        CheckoutRequest billing = request == null ? new CheckoutRequest() : request;
        CheckoutCommand command = CheckoutCommand.builder()
                .userId(userId)
                .conferenceSlug(slug)
                .billingName(billing.getBillingName())
                .billingEmail(billing.getBillingEmail())
                .billingCompany(billing.getBillingCompany())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(checkoutService.checkout(command)));
    }
}
