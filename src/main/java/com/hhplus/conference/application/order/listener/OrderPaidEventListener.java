package com.hhplus.conference.application.order.listener;

import com.hhplus.conference.domain.order.event.OrderPaidEvent;
import com.hhplus.conference.infrastructure.kafka.OrderPaidEventProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 결제 완료 이벤트를 커밋 이후 Kafka 로 전달
 *
 * 알림 전송 실패는 로그만 남기며 이미 커밋된 결제 상태에 영향을 주지 않는다.
 */
@Slf4j
@Component
public class OrderPaidEventListener {

    private final OrderPaidEventProducer orderPaidEventProducer;

    public OrderPaidEventListener(OrderPaidEventProducer orderPaidEventProducer) {
        this.orderPaidEventProducer = orderPaidEventProducer;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderPaid(OrderPaidEvent event) {
        log.info("[OrderPaidEventListener] 결제 완료 알림 전달 - orderId={}, reference={}",
                event.getOrderId(), event.getReference());
        try {
            orderPaidEventProducer.publish(event);
        } catch (RuntimeException e) {
            log.error("[OrderPaidEventListener] 결제 완료 알림 전달 실패 - orderId={}", event.getOrderId(), e);
        }
    }
}
