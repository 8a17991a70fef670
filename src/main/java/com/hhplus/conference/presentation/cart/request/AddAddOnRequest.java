package com.hhplus.conference.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 애드온 담기 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddAddOnRequest {

    @NotNull
    @JsonProperty("addon_id")
    private Long addOnId;

    @NotNull
    private Integer quantity;
}
