package com.hhplus.conference.domain.cart;

import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;

/**
 * 장바구니가 OPEN이 아니거나 만료 시각이 지났을 때
 */
public class CartNotOpenException extends RegistrationValidationException {

    public CartNotOpenException(Long cartId, CartStatus status) {
        super(ErrorCode.CART_NOT_OPEN, "cartId=" + cartId + ", status=" + status);
    }
}
