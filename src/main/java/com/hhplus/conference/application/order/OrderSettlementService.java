package com.hhplus.conference.application.order;

import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderPaidNotifier;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.payment.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문을 PAID 로 바꾸는 공통 경로
 *
 * 호출자는 이미 주문 행을 잠근 트랜잭션 안에 있어야 한다.
 * PAID 전환, 보류 해제, 결제 완료 알림을 한 곳에서 처리한다.
 */
@Slf4j
@Component
public class OrderSettlementService {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final OrderPaidNotifier orderPaidNotifier;

    public OrderSettlementService(OrderRepository orderRepository,
                                  PaymentRepository paymentRepository,
                                  OrderPaidNotifier orderPaidNotifier) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.orderPaidNotifier = orderPaidNotifier;
    }

    public void markPaid(Order order, LocalDateTime now) {
        order.markPaid(now);
        orderRepository.save(order);
        log.info("[OrderSettlementService] 주문 결제 완료 - orderId={}, reference={}, total={}",
                order.getOrderId(), order.getReference(), order.getTotal());
        orderPaidNotifier.notifyPaid(order);
    }

    /**
     * 성공한 결제 합계가 주문 총액 이상이면 PAID 로 전환
     *
     * @return 이번 호출로 PAID 가 되었는지 여부
     */
    public boolean settleIfCovered(Order order, LocalDateTime now) {
        BigDecimal paid = paymentRepository.sumSucceededAmount(order.getOrderId());
        if (paid.compareTo(order.getTotal()) < 0) {
            log.debug("[OrderSettlementService] 미결제 잔액 있음 - orderId={}, paid={}, total={}",
                    order.getOrderId(), paid, order.getTotal());
            return false;
        }
        markPaid(order, now);
        return true;
    }

    /**
     * 남은 결제 잔액 = total − Σ(SUCCEEDED 결제)
     */
    public BigDecimal remainingBalance(Order order) {
        return order.getTotal().subtract(paymentRepository.sumSucceededAmount(order.getOrderId()));
    }
}
