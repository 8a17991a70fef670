package com.hhplus.conference.application.cart;

import com.hhplus.conference.domain.cart.CartItem;
import com.hhplus.conference.domain.cart.CartRepository;
import com.hhplus.conference.domain.catalog.AddOn;
import com.hhplus.conference.domain.catalog.AddOnNotFoundException;
import com.hhplus.conference.domain.catalog.AddOnRepository;
import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.catalog.TicketTypeNotFoundException;
import com.hhplus.conference.domain.catalog.TicketTypeRepository;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 장바구니 라인과 상품 정보를 한 번에 읽어 CartContents 로 조립
 *
 * 장바구니 요약(미리보기)과 체크아웃이 같은 조립 결과를 사용한다.
 */
@Component
public class CartContentsLoader {

    private final CartRepository cartRepository;
    private final TicketTypeRepository ticketTypeRepository;
    private final AddOnRepository addOnRepository;

    public CartContentsLoader(CartRepository cartRepository,
                              TicketTypeRepository ticketTypeRepository,
                              AddOnRepository addOnRepository) {
        this.cartRepository = cartRepository;
        this.ticketTypeRepository = ticketTypeRepository;
        this.addOnRepository = addOnRepository;
    }

    public CartContents load(Long cartId) {
        List<CartItem> items = cartRepository.findItems(cartId);
        Map<Long, TicketType> ticketTypes = new HashMap<>();
        Map<Long, AddOn> addOns = new HashMap<>();
        for (CartItem item : items) {
            if (item.isTicket()) {
                ticketTypes.computeIfAbsent(item.getTicketTypeId(), id -> ticketTypeRepository.findById(id)
                        .orElseThrow(() -> new TicketTypeNotFoundException(id)));
            } else {
                addOns.computeIfAbsent(item.getAddOnId(), id -> addOnRepository.findById(id)
                        .orElseThrow(() -> new AddOnNotFoundException(id)));
            }
        }
        return new CartContents(items, ticketTypes, addOns);
    }
}
