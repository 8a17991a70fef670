package com.hhplus.conference.application.inventory;

import com.hhplus.conference.domain.catalog.AddOn;
import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceNotFoundException;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import com.hhplus.conference.domain.inventory.CapacityExceededException;
import com.hhplus.conference.domain.inventory.PerUserLimitExceededException;
import com.hhplus.conference.domain.order.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.OptionalLong;

/**
 * InventoryLedger - 확정 수량 집계와 초과 판매 방지
 *
 * 역할:
 * - "확정 수량" = PAID / PARTIALLY_REFUNDED 주문 + 보류 기간이 남은 PENDING 주문의 라인 수량 합
 * - 남은 수량 계산 (totalQuantity == 0 이면 무제한 → empty)
 * - 티켓 유형, 애드온, 컨퍼런스 전체 정원, 1인 한도 검증
 *
 * 비즈니스 규칙:
 * - 만료된 보류는 조회 시점의 조건식으로 자동 제외 (정리 작업 없음)
 * - 항상 새로 계산하며 캐시하지 않는다
 * - 초과 시 수량을 줄이지 않고 검증 예외로 거부
 *
 * 동시성 제어:
 * - 호출자는 트랜잭션 안에서 해당 상품 행 또는 컨퍼런스 행을 먼저 잠근다
 */
@Slf4j
@Service
public class InventoryLedger {

    private final OrderRepository orderRepository;
    private final ConferenceRepository conferenceRepository;

    public InventoryLedger(OrderRepository orderRepository, ConferenceRepository conferenceRepository) {
        this.orderRepository = orderRepository;
        this.conferenceRepository = conferenceRepository;
    }

    /**
     * @return 남은 수량, 무제한이면 empty
     */
    public OptionalLong remaining(TicketType ticketType, LocalDateTime now) {
        if (ticketType.isUnlimited()) {
            return OptionalLong.empty();
        }
        long committed = orderRepository.sumCommittedTicketQuantity(ticketType.getId(), now);
        return OptionalLong.of(ticketType.getTotalQuantity() - committed);
    }

    public OptionalLong remaining(AddOn addOn, LocalDateTime now) {
        if (addOn.isUnlimited()) {
            return OptionalLong.empty();
        }
        long committed = orderRepository.sumCommittedAddOnQuantity(addOn.getId(), now);
        return OptionalLong.of(addOn.getTotalQuantity() - committed);
    }

    public OptionalLong globalRemaining(Conference conference, LocalDateTime now) {
        if (!conference.hasGlobalCapacity()) {
            return OptionalLong.empty();
        }
        long committed = orderRepository.sumCommittedConferenceTicketQuantity(conference.getConferenceId(), now);
        return OptionalLong.of(conference.getTotalCapacity() - committed);
    }

    /**
     * 티켓 추가 검증
     *
     * @param requestedQty           이번에 추가하려는 수량
     * @param alreadyInCart          같은 티켓 유형이 이미 장바구니에 담긴 수량
     * @param alreadyPurchasedByUser 사용자가 이미 구매한 수량 (PAID / PARTIALLY_REFUNDED)
     * @throws CapacityExceededException     remaining < requestedQty + alreadyInCart
     * @throws PerUserLimitExceededException alreadyInCart + alreadyPurchased + requestedQty > limitPerUser
     */
    public void validateTicketAdd(TicketType ticketType, int requestedQty, long alreadyInCart,
                                  long alreadyPurchasedByUser, LocalDateTime now) {
        OptionalLong remaining = remaining(ticketType, now);
        long desired = requestedQty + alreadyInCart;
        if (remaining.isPresent() && remaining.getAsLong() < desired) {
            log.info("[InventoryLedger] 티켓 재고 부족 - ticketTypeId={}, remaining={}, desired={}",
                    ticketType.getId(), remaining.getAsLong(), desired);
            throw new CapacityExceededException(ticketType.getName(), remaining.getAsLong(), desired);
        }
        long held = alreadyInCart + alreadyPurchasedByUser;
        if (held + requestedQty > ticketType.getLimitPerUser()) {
            throw new PerUserLimitExceededException(ticketType.getName(), ticketType.getLimitPerUser(), held);
        }
    }

    /**
     * 애드온 추가 검증 (1인 한도 없음, 전체 정원 미포함)
     */
    public void validateAddOnAdd(AddOn addOn, int requestedQty, long alreadyInCart, LocalDateTime now) {
        OptionalLong remaining = remaining(addOn, now);
        long desired = requestedQty + alreadyInCart;
        if (remaining.isPresent() && remaining.getAsLong() < desired) {
            log.info("[InventoryLedger] 애드온 재고 부족 - addOnId={}, remaining={}, desired={}",
                    addOn.getId(), remaining.getAsLong(), desired);
            throw new CapacityExceededException(addOn.getName(), remaining.getAsLong(), desired);
        }
    }

    /**
     * 컨퍼런스 전체 정원 검증
     *
     * 정원이 있으면 컨퍼런스 행을 FOR UPDATE 로 잠근 뒤 집계한다.
     * 호출자는 트랜잭션 안에 있어야 한다.
     *
     * @param desiredTicketTotal 장바구니의 티켓 수량 합 (애드온 제외)
     */
    public void validateGlobalCapacity(Conference conference, long desiredTicketTotal, LocalDateTime now) {
        if (!conference.hasGlobalCapacity()) {
            return;
        }
        Conference locked = conferenceRepository.findByIdForUpdate(conference.getConferenceId())
                .orElseThrow(() -> new ConferenceNotFoundException(conference.getConferenceId()));
        OptionalLong remaining = globalRemaining(locked, now);
        if (remaining.isPresent() && desiredTicketTotal > remaining.getAsLong()) {
            log.info("[InventoryLedger] 컨퍼런스 정원 초과 - conferenceId={}, remaining={}, desired={}",
                    locked.getConferenceId(), remaining.getAsLong(), desiredTicketTotal);
            throw new CapacityExceededException(locked.getName(), remaining.getAsLong(), desiredTicketTotal);
        }
    }
}
