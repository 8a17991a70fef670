package com.hhplus.conference.application.payment;

import com.hhplus.conference.application.order.OrderSettlementService;
import com.hhplus.conference.application.payment.dto.PaymentIntentResponse;
import com.hhplus.conference.common.exception.ApplicationException;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.common.vo.Money;
import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceNotFoundException;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.payment.PaymentGateway;
import com.hhplus.conference.domain.payment.PaymentIntentRequest;
import com.hhplus.conference.domain.payment.PaymentIntentResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * PaymentService - 카드 결제 시작 (Application 계층)
 *
 * 처리 흐름:
 * 1. 주문 / 잔액 확인 (트랜잭션 없음)
 * 2. 결제 대행사 호출 (DB 잠금을 잡지 않은 상태에서 외부 호출)
 * 3. PENDING 결제 기록 (PaymentRecordService, 별도 트랜잭션)
 *
 * 결제 확정은 웹훅(payment_intent.succeeded)이 처리한다.
 */
@Slf4j
@Service
public class PaymentService {

    private final OrderRepository orderRepository;
    private final ConferenceRepository conferenceRepository;
    private final OrderSettlementService orderSettlementService;
    private final PaymentRecordService paymentRecordService;
    private final PaymentGateway paymentGateway;
    private final RegistrationProperties properties;

    public PaymentService(OrderRepository orderRepository,
                          ConferenceRepository conferenceRepository,
                          OrderSettlementService orderSettlementService,
                          PaymentRecordService paymentRecordService,
                          PaymentGateway paymentGateway,
                          RegistrationProperties properties) {
        this.orderRepository = orderRepository;
        this.conferenceRepository = conferenceRepository;
        this.orderSettlementService = orderSettlementService;
        this.paymentRecordService = paymentRecordService;
        this.paymentGateway = paymentGateway;
        this.properties = properties;
    }

    /**
     * 남은 잔액에 대한 PaymentIntent 생성
     *
     * @throws RegistrationValidationException PENDING 이 아니거나 이미 전액 결제된 주문
     * @throws ApplicationException            컨퍼런스에 Stripe 키가 없는 경우
     */
    public PaymentIntentResponse initiatePayment(Long userId, Long orderId) {
        Order order = orderRepository.findById(orderId)
                .filter(o -> o.getUserId().equals(userId))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isPending()) {
            throw new RegistrationValidationException(ErrorCode.ORDER_NOT_PENDING,
                    "orderId=" + orderId + ", status=" + order.getStatus());
        }

        BigDecimal remaining = orderSettlementService.remainingBalance(order);
        if (remaining.signum() <= 0) {
            throw new RegistrationValidationException(ErrorCode.ORDER_ALREADY_PAID, "orderId=" + orderId);
        }

        Conference conference = conferenceRepository.findById(order.getConferenceId())
                .orElseThrow(() -> new ConferenceNotFoundException(order.getConferenceId()));
        if (conference.getStripeSecretKey() == null || conference.getStripeSecretKey().isBlank()) {
            throw new ApplicationException(ErrorCode.PAYMENT_GATEWAY_NOT_CONFIGURED, conference.getSlug());
        }

        String currency = properties.getCurrency();
        PaymentIntentResult intent = paymentGateway.createPaymentIntent(PaymentIntentRequest.builder()
                .secretKey(conference.getStripeSecretKey())
                .amountMinorUnits(Money.of(remaining).toMinorUnits(currency))
                .currency(currency)
                .orderId(order.getOrderId())
                .reference(order.getReference())
                .receiptEmail(order.getBillingEmail())
                .build());

        paymentRecordService.recordPendingIntent(orderId, remaining, intent.getPaymentIntentId());

        log.info("[PaymentService] 결제 시작 - orderId={}, intentId={}, amount={} {}, key={}",
                orderId, intent.getPaymentIntentId(), remaining, currency, conference.maskedSecretKey());
        return PaymentIntentResponse.builder()
                .orderId(orderId)
                .reference(order.getReference())
                .paymentIntentId(intent.getPaymentIntentId())
                .clientSecret(intent.getClientSecret())
                .amount(remaining)
                .currency(currency)
                .build();
    }
}
