package com.hhplus.conference.infrastructure.stripe;

import com.hhplus.conference.domain.payment.PaymentGateway;
import com.hhplus.conference.domain.payment.PaymentGatewayException;
import com.hhplus.conference.domain.payment.PaymentIntentRequest;
import com.hhplus.conference.domain.payment.PaymentIntentResult;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Stripe PaymentIntent 어댑터
 *
 * 컨퍼런스마다 Stripe 계정이 다르므로 전역 Stripe.apiKey 대신 요청별 RequestOptions 로 키를 넘긴다.
 * 같은 주문의 재요청은 idempotency key(order-{id}-{금액})로 같은 PaymentIntent 를 돌려받는다.
 */
@Slf4j
@Component
public class StripePaymentGateway implements PaymentGateway {

    @Override
    public PaymentIntentResult createPaymentIntent(PaymentIntentRequest request) {
        PaymentIntentCreateParams.Builder params = PaymentIntentCreateParams.builder()
                .setAmount(request.getAmountMinorUnits())
                .setCurrency(request.getCurrency().toLowerCase(Locale.ROOT))
                .putMetadata("order_id", String.valueOf(request.getOrderId()))
                .putMetadata("reference", request.getReference())
                .setAutomaticPaymentMethods(PaymentIntentCreateParams.AutomaticPaymentMethods.builder()
                        .setEnabled(true)
                        .build());
        if (request.getReceiptEmail() != null && !request.getReceiptEmail().isBlank()) {
            params.setReceiptEmail(request.getReceiptEmail());
        }

        RequestOptions options = RequestOptions.builder()
                .setApiKey(request.getSecretKey())
                .setIdempotencyKey("order-" + request.getOrderId() + "-" + request.getAmountMinorUnits())
                .build();

        try {
            PaymentIntent intent = PaymentIntent.create(params.build(), options);
            log.info("[StripePaymentGateway] PaymentIntent 생성 - orderId={}, intentId={}, amount={}",
                    request.getOrderId(), intent.getId(), request.getAmountMinorUnits());
            return new PaymentIntentResult(intent.getId(), intent.getClientSecret());
        } catch (StripeException e) {
            log.error("[StripePaymentGateway] PaymentIntent 생성 실패 - orderId={}, code={}, requestId={}",
                    request.getOrderId(), e.getCode(), e.getRequestId(), e);
            throw new PaymentGatewayException("orderId=" + request.getOrderId(), e);
        }
    }
}
