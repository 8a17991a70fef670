package com.hhplus.conference.presentation.admin;

import com.hhplus.conference.application.webhook.WebhookDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 저장된 웹훅 이벤트 재처리 API
 */
@RestController
@RequestMapping("/admin/webhooks/events")
public class AdminWebhookController {

    private final WebhookDispatcher webhookDispatcher;

    public AdminWebhookController(WebhookDispatcher webhookDispatcher) {
        this.webhookDispatcher = webhookDispatcher;
    }

    /**
     * POST /admin/webhooks/events/{stripe_id}/replay
     *
     * 처리 실패는 응답 코드가 아니라 processed=false 와 실패 기록으로 확인한다.
     */
    @PostMapping("/{stripe_id}/replay")
    public ResponseEntity<Map<String, Object>> replay(@PathVariable("stripe_id") String stripeId) {
        boolean processed = webhookDispatcher.replay(stripeId);
        return ResponseEntity.ok(Map.of("stripe_id", stripeId, "processed", processed));
    }
}
