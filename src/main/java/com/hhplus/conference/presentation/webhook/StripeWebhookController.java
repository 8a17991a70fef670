package com.hhplus.conference.presentation.webhook;

import com.hhplus.conference.application.webhook.WebhookDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Stripe 웹훅 수신 엔드포인트
 *
 * 서명은 원본 바이트 기준이므로 본문을 String 으로 그대로 받는다.
 * 처리 결과와 무관하게 항상 200 을 돌려준다.
 */
@RestController
@RequestMapping("/webhooks/stripe")
public class StripeWebhookController {

    private final WebhookDispatcher webhookDispatcher;

    public StripeWebhookController(WebhookDispatcher webhookDispatcher) {
        this.webhookDispatcher = webhookDispatcher;
    }

    @PostMapping({"/{slug}", "/{slug}/"})
    public ResponseEntity<Void> receive(
            @PathVariable("slug") String slug,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature,
            @RequestBody String payload) {
        webhookDispatcher.receive(slug, payload, signature);
        return ResponseEntity.ok().build();
    }
}
