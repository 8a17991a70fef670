package com.hhplus.conference.application.cart.dto;

import com.hhplus.conference.domain.cart.Cart;
import com.hhplus.conference.domain.cart.CartStatus;
import com.hhplus.conference.domain.pricing.PricingResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 요약 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartSummary {
    private Long cartId;
    private Long conferenceId;
    private CartStatus status;
    private String voucherCode;
    private LocalDateTime expiresAt;
    private List<CartLineSummary> items;
    private BigDecimal subtotal;
    private BigDecimal discount;
    private BigDecimal total;

    public static CartSummary of(Cart cart, String voucherCode, PricingResult pricing) {
        return CartSummary.builder()
                .cartId(cart.getCartId())
                .conferenceId(cart.getConferenceId())
                .status(cart.getStatus())
                .voucherCode(voucherCode)
                .expiresAt(cart.getExpiresAt())
                .items(pricing.getLines().stream()
                        .map(CartLineSummary::from)
                        .collect(Collectors.toList()))
                .subtotal(pricing.getSubtotal().getAmount())
                .discount(pricing.getDiscount().getAmount())
                .total(pricing.getTotal().getAmount())
                .build();
    }
}
