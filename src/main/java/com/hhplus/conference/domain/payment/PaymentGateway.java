package com.hhplus.conference.domain.payment;

/**
 * 결제 대행사 포트 (단일 대행사만 지원)
 */
public interface PaymentGateway {

    /**
     * 결제 의도(PaymentIntent) 생성
     *
     * @throws PaymentGatewayException 대행사 호출 실패
     */
    PaymentIntentResult createPaymentIntent(PaymentIntentRequest request);
}
