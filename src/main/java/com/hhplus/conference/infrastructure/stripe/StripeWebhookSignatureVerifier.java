package com.hhplus.conference.infrastructure.stripe;

import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.webhook.InvalidWebhookSignatureException;
import com.hhplus.conference.domain.webhook.WebhookSignatureVerifier;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import org.springframework.stereotype.Component;

/**
 * Stripe-Signature 헤더 검증 어댑터 (t=타임스탬프, v1=HMAC-SHA256)
 */
@Component
public class StripeWebhookSignatureVerifier implements WebhookSignatureVerifier {

    private final RegistrationProperties properties;

    public StripeWebhookSignatureVerifier(RegistrationProperties properties) {
        this.properties = properties;
    }

    @Override
    public void verify(String payload, String signatureHeader, String secret) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException("Stripe-Signature 헤더 없음");
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, secret,
                    properties.getStripe().getWebhookToleranceSeconds());
        } catch (SignatureVerificationException e) {
            throw new InvalidWebhookSignatureException(e.getMessage(), e);
        }
    }
}
