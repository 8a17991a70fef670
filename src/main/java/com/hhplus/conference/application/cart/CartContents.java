package com.hhplus.conference.application.cart;

import com.hhplus.conference.domain.cart.CartItem;
import com.hhplus.conference.domain.catalog.AddOn;
import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.common.vo.Money;
import com.hhplus.conference.domain.pricing.PricingLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 장바구니 라인과 라인이 가리키는 상품을 함께 묶은 읽기 전용 스냅샷
 *
 * 라인 순서는 cart_item_id 오름차순이며 할인 배분 순서로 그대로 쓰인다.
 */
public class CartContents {

    private final List<CartItem> items;
    private final Map<Long, TicketType> ticketTypes;
    private final Map<Long, AddOn> addOns;

    CartContents(List<CartItem> items, Map<Long, TicketType> ticketTypes, Map<Long, AddOn> addOns) {
        this.items = List.copyOf(items);
        this.ticketTypes = Map.copyOf(ticketTypes);
        this.addOns = Map.copyOf(addOns);
    }

    public List<CartItem> getItems() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public TicketType ticketTypeOf(CartItem item) {
        return ticketTypes.get(item.getTicketTypeId());
    }

    public AddOn addOnOf(CartItem item) {
        return addOns.get(item.getAddOnId());
    }

    public Set<Long> ticketTypeIds() {
        Set<Long> ids = new LinkedHashSet<>();
        for (CartItem item : items) {
            if (item.isTicket()) {
                ids.add(item.getTicketTypeId());
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * 장바구니에 담긴 티켓 수량 합 (애드온 제외, 컨퍼런스 정원 검증용)
     */
    public long ticketQuantity() {
        long total = 0;
        for (CartItem item : items) {
            if (item.isTicket()) {
                total += item.getQuantity();
            }
        }
        return total;
    }

    public List<PricingLine> toPricingLines() {
        List<PricingLine> lines = new ArrayList<>(items.size());
        for (CartItem item : items) {
            if (item.isTicket()) {
                TicketType ticketType = ticketTypeOf(item);
                lines.add(PricingLine.ticket(item.getCartItemId(), ticketType.getId(), ticketType.getName(),
                        item.getQuantity(), Money.of(ticketType.getPrice())));
            } else {
                AddOn addOn = addOnOf(item);
                lines.add(PricingLine.addOn(item.getCartItemId(), addOn.getId(), addOn.getName(),
                        item.getQuantity(), Money.of(addOn.getPrice())));
            }
        }
        return lines;
    }
}
