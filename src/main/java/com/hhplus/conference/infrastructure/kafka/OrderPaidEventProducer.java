package com.hhplus.conference.infrastructure.kafka;

import com.hhplus.conference.domain.order.event.OrderPaidEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * OrderPaidEventProducer - 결제 완료 이벤트 Kafka 발행
 *
 * Kafka 메시지 구조:
 * - Key: 주문 reference → 같은 주문은 같은 파티션
 * - Value: OrderPaidEvent (JSON)
 * - Topic: kafka.topics.order-paid
 *
 * 이메일 발송 등 후속 처리는 이 토픽을 구독하는 별도 서비스가 담당한다.
 */
@Slf4j
@Service
public class OrderPaidEventProducer {

    private final KafkaTemplate<String, OrderPaidEvent> kafkaTemplate;
    private final String topicName;

    public OrderPaidEventProducer(KafkaTemplate<String, OrderPaidEvent> kafkaTemplate,
                                  @Value("${kafka.topics.order-paid}") String topicName) {
        this.kafkaTemplate = kafkaTemplate;
        this.topicName = topicName;
    }

    public void publish(OrderPaidEvent event) {
        String key = event.getReference();

        CompletableFuture<SendResult<String, OrderPaidEvent>> future = kafkaTemplate.send(topicName, key, event);
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                var metadata = result.getRecordMetadata();
                log.info("[OrderPaidEventProducer] Kafka 메시지 발행 성공 - topic={}, partition={}, offset={}, orderId={}",
                        metadata.topic(), metadata.partition(), metadata.offset(), event.getOrderId());
            } else {
                log.error("[OrderPaidEventProducer] Kafka 메시지 발행 실패 - topic={}, key={}, orderId={}",
                        topicName, key, event.getOrderId(), ex);
            }
        });
    }
}
