package com.hhplus.conference.integration;

import com.hhplus.conference.application.cart.CartService;
import com.hhplus.conference.application.checkout.CheckoutService;
import com.hhplus.conference.application.checkout.dto.CheckoutCommand;
import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.application.webhook.WebhookDispatcher;
import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.catalog.TicketTypeRepository;
import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.order.OrderStatus;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.payment.PaymentStatus;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Stripe 웹훅 통합 테스트
 *
 * 서명 검증 → 이벤트 저장 → 핸들러 실행 → 주문 PAID → 커밋 후 결제 완료 이벤트 발행까지
 * 실제 DB 위에서 확인한다.
 */
@DisplayName("[Integration] Stripe 웹훅 처리 테스트")
class StripeWebhookIntegrationTest extends BaseIntegrationTest {

    private static final String WEBHOOK_SECRET = "whsec_integration";

    @Autowired
    private WebhookDispatcher webhookDispatcher;

    @Autowired
    private CartService cartService;

    @Autowired
    private CheckoutService checkoutService;

    @Autowired
    private ConferenceRepository conferenceRepository;

    @Autowired
    private TicketTypeRepository ticketTypeRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private PaymentRepository paymentRepository;

    @Autowired
    private StripeEventRepository stripeEventRepository;

    @Autowired
    private Clock clock;

    private String slug;
    private OrderResult order;

    @BeforeEach
    void setUp() {
        slug = "hook-" + UUID.randomUUID().toString().substring(0, 8);
        Conference conference = conferenceRepository.save(Conference.builder()
                .slug(slug)
                .name("웹훅 컨퍼런스")
                .active(true)
                .totalCapacity(0)
                .stripeWebhookSecret(WEBHOOK_SECRET)
                .createdAt(LocalDateTime.now(clock))
                .build());
        TicketType ticketType = ticketTypeRepository.save(TicketType.builder()
                .conferenceId(conference.getConferenceId())
                .name("Standard")
                .price(new BigDecimal("100.00"))
                .totalQuantity(0)
                .build());

        cartService.addTicket(1L, slug, ticketType.getId(), 1);
        order = checkoutService.checkout(CheckoutCommand.builder()
                .userId(1L)
                .conferenceSlug(slug)
                .billingEmail("buyer@example.com")
                .build());
    }

    @Test
    @DisplayName("같은 payment_intent.succeeded 가 두 번 와도 주문은 한 번만 PAID 가 된다")
    void paymentIntentSucceeded_deliveredTwice_processedOnce() throws Exception {
        // Given
        String stripeId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        String payload = succeededPayload(stripeId, "pi_" + slug, order.getOrderId(), 10000);

        // When
        webhookDispatcher.receive(slug, payload, sign(payload));
        webhookDispatcher.receive(slug, payload, sign(payload));

        // Then
        Order paid = orderRepository.findById(order.getOrderId()).orElseThrow();
        assertEquals(OrderStatus.PAID, paid.getStatus());
        assertNull(paid.getHoldExpiresAt());

        List<Payment> payments = paymentRepository.findByOrderId(order.getOrderId());
        assertEquals(1, payments.size());
        assertEquals(PaymentStatus.SUCCEEDED, payments.get(0).getStatus());
        assertEquals(0, new BigDecimal("100.00").compareTo(payments.get(0).getAmount()));

        StripeEvent event = stripeEventRepository.findByStripeId(stripeId).orElseThrow();
        assertTrue(event.isProcessed());

        verify(orderPaidEventProducer, timeout(2000).times(1)).publish(any());
    }

    @Test
    @DisplayName("서명이 맞지 않으면 이벤트를 저장하지 않고 주문도 그대로다")
    void invalidSignature_ignored() throws Exception {
        // Given
        String stripeId = "evt_" + UUID.randomUUID().toString().replace("-", "");
        String payload = succeededPayload(stripeId, "pi_bad_" + slug, order.getOrderId(), 10000);

        // When
        webhookDispatcher.receive(slug, payload, "t=1,v1=deadbeef");

        // Then
        assertFalse(stripeEventRepository.existsByStripeId(stripeId));
        assertEquals(OrderStatus.PENDING, orderRepository.findById(order.getOrderId()).orElseThrow().getStatus());
    }

    private String succeededPayload(String stripeId, String intentId, Long orderId, long amount) {
        return "{"
                + "\"id\":\"" + stripeId + "\","
                + "\"type\":\"payment_intent.succeeded\","
                + "\"livemode\":false,"
                + "\"data\":{\"object\":{"
                + "\"id\":\"" + intentId + "\","
                + "\"object\":\"payment_intent\","
                + "\"amount\":" + amount + ","
                + "\"currency\":\"usd\","
                + "\"latest_charge\":\"ch_" + stripeId + "\","
                + "\"metadata\":{\"order_id\":\"" + orderId + "\"}"
                + "}}}";
    }

    private String sign(String payload) throws Exception {
        long timestamp = Instant.now().getEpochSecond();
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(WEBHOOK_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] digest = mac.doFinal((timestamp + "." + payload).getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder();
        for (byte b : digest) {
            hex.append(String.format("%02x", b));
        }
        return "t=" + timestamp + ",v1=" + hex;
    }
}
