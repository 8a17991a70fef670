package com.hhplus.conference.infrastructure.notification;

import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderPaidNotifier;
import com.hhplus.conference.domain.order.event.OrderPaidEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * OrderPaidNotifier 기본 구현
 *
 * 스프링 이벤트로만 발행하고, 실제 전송은 커밋 이후 리스너(OrderPaidEventListener)가 맡는다.
 * 트랜잭션이 롤백되면 이벤트도 버려진다.
 */
@Slf4j
@Component
public class SpringEventOrderPaidNotifier implements OrderPaidNotifier {

    private final ApplicationEventPublisher eventPublisher;

    public SpringEventOrderPaidNotifier(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @Override
    public void notifyPaid(Order order) {
        OrderPaidEvent event = OrderPaidEvent.from(order);
        eventPublisher.publishEvent(event);
        log.debug("[SpringEventOrderPaidNotifier] 결제 완료 이벤트 발행 - orderId={}, reference={}",
                order.getOrderId(), order.getReference());
    }
}
