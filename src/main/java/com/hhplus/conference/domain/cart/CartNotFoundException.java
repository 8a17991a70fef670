package com.hhplus.conference.domain.cart;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class CartNotFoundException extends DomainException {

    public CartNotFoundException(Long cartId) {
        super(ErrorCode.CART_NOT_FOUND, "cartId=" + cartId);
    }
}
