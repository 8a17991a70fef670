package com.hhplus.conference.domain.order;

/**
 * 주문 결제 완료 알림 포트
 *
 * 주문을 PAID 로 바꾼 모든 경로(웹훅, 크레딧, 수동 결제, comp)가 호출한다.
 * 구현체는 트랜잭션 커밋 이후에만 외부로 알림을 내보내야 한다.
 */
public interface OrderPaidNotifier {

    void notifyPaid(Order order);
}
