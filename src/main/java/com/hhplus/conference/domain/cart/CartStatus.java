package com.hhplus.conference.domain.cart;

import lombok.Getter;

/**
 * CartStatus - 장바구니 생명주기
 *
 * OPEN → CHECKED_OUT (체크아웃 성공)
 * OPEN → EXPIRED / ABANDONED (만료 정리)
 * OPEN 이외 상태의 장바구니는 재사용하지 않는다.
 */
@Getter
public enum CartStatus {
    OPEN("사용 중"),
    CHECKED_OUT("주문 완료"),
    EXPIRED("만료"),
    ABANDONED("포기");

    private final String displayName;

    CartStatus(String displayName) {
        this.displayName = displayName;
    }
}
