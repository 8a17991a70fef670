package com.hhplus.conference.domain.webhook;

/**
 * 웹훅 서명 검증 Port
 */
public interface WebhookSignatureVerifier {

    /**
     * @param payload         수신한 원본 본문 (파싱 전 바이트 그대로)
     * @param signatureHeader Stripe-Signature 헤더 값
     * @param secret          컨퍼런스별 웹훅 서명 비밀값
     * @throws InvalidWebhookSignatureException 서명 불일치, 헤더 누락, 허용 오차 초과
     */
    void verify(String payload, String signatureHeader, String secret);
}
