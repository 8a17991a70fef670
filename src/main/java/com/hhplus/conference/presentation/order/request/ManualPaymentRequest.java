package com.hhplus.conference.presentation.order.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 수동 결제 입력 요청 DTO (계좌이체 등)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualPaymentRequest {

    @NotNull
    private BigDecimal amount;

    private String reference;

    private String note;
}
