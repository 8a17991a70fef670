package com.hhplus.conference.application.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.hhplus.conference.application.webhook.WebhookHandler;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.payment.PaymentStatus;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * payment_intent.payment_failed
 *
 * 진행 중(PENDING, PROCESSING)인 결제만 FAILED 로 바꾼다. 주문 상태는 건드리지 않는다.
 */
@Slf4j
@Component
public class PaymentIntentFailedHandler implements WebhookHandler {

    private static final String NO_ERROR_DETAILS = "No error details";

    private final PaymentRepository paymentRepository;
    private final Clock clock;

    public PaymentIntentFailedHandler(PaymentRepository paymentRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.clock = clock;
    }

    @Override
    public StripeEventType eventType() {
        return StripeEventType.PAYMENT_INTENT_PAYMENT_FAILED;
    }

    @Override
    public void processEvent(StripeEvent event, JsonNode intent) {
        String intentId = StripeObjects.textOrNull(intent.path("id"));
        String reason = StripeObjects.textOrNull(intent.path("last_payment_error").path("message"));
        if (reason == null) {
            reason = NO_ERROR_DETAILS;
        }

        Optional<Payment> payment = intentId == null
                ? Optional.empty()
                : paymentRepository.findByPaymentIntentIdForUpdate(intentId)
                        .filter(p -> PaymentStatus.IN_FLIGHT.contains(p.getStatus()));
        if (payment.isEmpty()) {
            log.warn("[PaymentIntentFailedHandler] 진행 중인 결제 없음 - intentId={}, reason={}", intentId, reason);
            return;
        }

        Payment failed = payment.get();
        failed.markFailed(LocalDateTime.now(clock));
        paymentRepository.save(failed);
        log.warn("[PaymentIntentFailedHandler] 결제 실패 - orderId={}, intentId={}, reason={}",
                failed.getOrderId(), intentId, reason);
    }
}
