package com.hhplus.conference.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.conference.application.cart.dto.CartSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 가격 미리보기 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("cart_id")
    private Long cartId;

    @JsonProperty("conference_id")
    private Long conferenceId;

    private String status;

    @JsonProperty("voucher_code")
    private String voucherCode;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    @JsonProperty("expires_at")
    private LocalDateTime expiresAt;

    private List<CartItemResponse> items;

    private BigDecimal subtotal;

    private BigDecimal discount;

    private BigDecimal total;

    public static CartResponse from(CartSummary summary) {
        return CartResponse.builder()
                .cartId(summary.getCartId())
                .conferenceId(summary.getConferenceId())
                .status(summary.getStatus().name())
                .voucherCode(summary.getVoucherCode())
                .expiresAt(summary.getExpiresAt())
                .items(summary.getItems().stream()
                        .map(CartItemResponse::from)
                        .collect(Collectors.toList()))
                .subtotal(summary.getSubtotal())
                .discount(summary.getDiscount())
                .total(summary.getTotal())
                .build();
    }
}
