package com.hhplus.conference.domain.voucher;

import lombok.Getter;

/**
 * VoucherType - 바우처 할인 방식
 *
 * - COMP: 적용 대상 라인 100% 할인
 * - PERCENTAGE: 적용 대상 라인마다 discountValue% 할인
 * - FIXED_AMOUNT: discountValue 금액을 적용 대상 라인에 비례 배분
 */
@Getter
public enum VoucherType {
    COMP("무료"),
    PERCENTAGE("정률 할인"),
    FIXED_AMOUNT("정액 할인");

    private final String displayName;

    VoucherType(String displayName) {
        this.displayName = displayName;
    }
}
