package com.hhplus.conference.domain.cart;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long cartItemId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "cartItemId=" + cartItemId);
    }
}
