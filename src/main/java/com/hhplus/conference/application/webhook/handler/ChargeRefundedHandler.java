package com.hhplus.conference.application.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.hhplus.conference.application.webhook.WebhookHandler;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.common.vo.Money;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.order.OrderStatus;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentNotFoundException;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * charge.refunded
 *
 * 환불 누계가 청구 금액 이상이면 전액 환불(결제 REFUNDED, 주문 REFUNDED),
 * 아니면 부분 환불(주문 PARTIALLY_REFUNDED)로 처리한다.
 * 주문이 이미 목표 상태면 아무것도 하지 않는다.
 * PARTIALLY_REFUNDED → REFUNDED 는 허용되지 않은 전환이므로 실패로 기록된다.
 * 대상 결제가 아직 없으면 실패로 기록되고, 결제가 생긴 뒤 재처리할 수 있다.
 */
@Slf4j
@Component
public class ChargeRefundedHandler implements WebhookHandler {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final RegistrationProperties properties;
    private final Clock clock;

    public ChargeRefundedHandler(PaymentRepository paymentRepository,
                                 OrderRepository orderRepository,
                                 RegistrationProperties properties,
                                 Clock clock) {
        this.paymentRepository = paymentRepository;
        this.orderRepository = orderRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public StripeEventType eventType() {
        return StripeEventType.CHARGE_REFUNDED;
    }

    @Override
    public void processEvent(StripeEvent event, JsonNode charge) {
        String intentId = StripeObjects.idOf(charge.path("payment_intent"));
        if (intentId == null) {
            throw new IllegalArgumentException("charge.payment_intent 없음 - stripeId=" + event.getStripeId());
        }
        // 결제 성공 이벤트보다 먼저 도착할 수 있다. 실패로 남겨 재처리 대상이 되게 한다
        Payment payment = paymentRepository.findByPaymentIntentIdForUpdate(intentId)
                .orElseThrow(() -> new PaymentNotFoundException(intentId));
        LocalDateTime now = LocalDateTime.now(clock);

        long chargedMinor = charge.path("amount").asLong();
        long refundedMinor = charge.path("amount_refunded").asLong();
        boolean fullRefund = refundedMinor >= chargedMinor;
        String currency = charge.path("currency").asText(properties.getCurrency());

        Order order = orderRepository.findByIdForUpdate(payment.getOrderId())
                .orElseThrow(() -> new OrderNotFoundException(payment.getOrderId()));

        if (fullRefund) {
            payment.markRefunded(now);
            paymentRepository.save(payment);
        }

        OrderStatus target = fullRefund ? OrderStatus.REFUNDED : OrderStatus.PARTIALLY_REFUNDED;
        if (order.getStatus() == target) {
            log.info("[ChargeRefundedHandler] 이미 {} 상태 - orderId={}", target, order.getOrderId());
            return;
        }
        order.transitionTo(target, now);
        orderRepository.save(order);

        log.info("[ChargeRefundedHandler] 환불 반영 - orderId={}, status={}, refunded={}, charged={}",
                order.getOrderId(), target,
                Money.fromMinorUnits(refundedMinor, currency),
                Money.fromMinorUnits(chargedMinor, currency));
    }
}
