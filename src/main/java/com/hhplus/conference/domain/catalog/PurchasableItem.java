package com.hhplus.conference.domain.catalog;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 장바구니에 담을 수 있는 판매 단위 (TicketType, AddOn) 공통 계약
 *
 * 재고 한도(totalQuantity)가 0이면 무제한이다.
 */
public interface PurchasableItem {

    Long getId();

    Long getConferenceId();

    String getName();

    BigDecimal getPrice();

    int getTotalQuantity();

    boolean isActive();

    LocalDateTime getAvailableFrom();

    LocalDateTime getAvailableUntil();

    default boolean isUnlimited() {
        return getTotalQuantity() == 0;
    }

    /**
     * 활성 상태이고 판매 기간 안에 있는지 확인 (재고는 InventoryLedger가 판단)
     */
    default boolean isWithinSalesWindow(LocalDateTime now) {
        if (!isActive()) {
            return false;
        }
        if (getAvailableFrom() != null && now.isBefore(getAvailableFrom())) {
            return false;
        }
        return getAvailableUntil() == null || !now.isAfter(getAvailableUntil());
    }
}
