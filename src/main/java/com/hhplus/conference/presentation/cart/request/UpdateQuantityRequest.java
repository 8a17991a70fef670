package com.hhplus.conference.presentation.cart.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * PUT /cart/items/{item_id} 본문. 0 이하면 항목 삭제
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UpdateQuantityRequest {

    @NotNull(message = "quantity 는 필수입니다")
    private Integer quantity;
}
