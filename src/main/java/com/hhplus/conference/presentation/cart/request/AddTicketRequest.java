package com.hhplus.conference.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 티켓 담기 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddTicketRequest {

    @NotNull
    @JsonProperty("ticket_type_id")
    private Long ticketTypeId;

    @NotNull
    private Integer quantity;
}
