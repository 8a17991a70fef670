package com.hhplus.conference.application.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.hhplus.conference.application.order.OrderSettlementService;
import com.hhplus.conference.application.webhook.WebhookHandler;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.common.vo.Money;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * payment_intent.succeeded
 *
 * metadata.order_id 의 주문을 잠그고 결제를 upsert 한 뒤 PENDING 주문을 PAID 로 바꾼다.
 * 이미 PAID 면 아무것도 하지 않는다. 그 외 상태는 허용되지 않은 전환으로 실패한다.
 */
@Slf4j
@Component
public class PaymentIntentSucceededHandler implements WebhookHandler {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final OrderSettlementService orderSettlementService;
    private final RegistrationProperties properties;
    private final Clock clock;

    public PaymentIntentSucceededHandler(OrderRepository orderRepository,
                                         PaymentRepository paymentRepository,
                                         OrderSettlementService orderSettlementService,
                                         RegistrationProperties properties,
                                         Clock clock) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.orderSettlementService = orderSettlementService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public StripeEventType eventType() {
        return StripeEventType.PAYMENT_INTENT_SUCCEEDED;
    }

    @Override
    public void processEvent(StripeEvent event, JsonNode intent) {
        String intentId = StripeObjects.textOrNull(intent.path("id"));
        String orderIdText = StripeObjects.textOrNull(intent.path("metadata").path("order_id"));
        if (intentId == null || orderIdText == null) {
            throw new IllegalArgumentException("PaymentIntent id 또는 metadata.order_id 없음 - stripeId=" + event.getStripeId());
        }
        Long orderId = Long.valueOf(orderIdText);
        LocalDateTime now = LocalDateTime.now(clock);

        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        String currency = intent.path("currency").asText(properties.getCurrency());
        BigDecimal amount = Money.fromMinorUnits(intent.path("amount").asLong(), currency).getAmount();
        String chargeId = StripeObjects.idOf(intent.path("latest_charge"));

        Optional<Payment> existing = paymentRepository.findByPaymentIntentIdForUpdate(intentId);
        if (existing.isPresent()) {
            Payment payment = existing.get();
            payment.markSucceeded(amount, chargeId, now);
            paymentRepository.save(payment);
        } else {
            paymentRepository.save(Payment.succeededStripe(orderId, amount, intentId, chargeId, now));
        }
        log.info("[PaymentIntentSucceededHandler] 결제 성공 기록 - orderId={}, intentId={}, amount={}",
                orderId, intentId, amount);

        if (order.isPaid()) {
            log.info("[PaymentIntentSucceededHandler] 이미 결제 완료된 주문 - orderId={}", orderId);
            return;
        }
        orderSettlementService.markPaid(order, now);
    }
}
