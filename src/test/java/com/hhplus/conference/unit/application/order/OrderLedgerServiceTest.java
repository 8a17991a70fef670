package com.hhplus.conference.unit.application.order;

import com.hhplus.conference.application.order.OrderLedgerService;
import com.hhplus.conference.application.order.OrderSettlementService;
import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.domain.credit.Credit;
import com.hhplus.conference.domain.credit.CreditRepository;
import com.hhplus.conference.domain.credit.CreditStatus;
import com.hhplus.conference.domain.order.IllegalOrderTransitionException;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderPaidNotifier;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.order.OrderStatus;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentMethod;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.payment.PaymentStatus;
import com.hhplus.conference.domain.voucher.Voucher;
import com.hhplus.conference.domain.voucher.VoucherRepository;
import com.hhplus.conference.domain.voucher.VoucherType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * OrderLedgerServiceTest - 주문 취소, 크레딧 적용
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderLedgerService 단위 테스트")
class OrderLedgerServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);
    private static final Long USER_ID = 100L;
    private static final Long CONFERENCE_ID = 1L;
    private static final Long ORDER_ID = 50L;
    private static final Long CREDIT_ID = 3L;

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private CreditRepository creditRepository;
    @Mock
    private VoucherRepository voucherRepository;
    @Mock
    private OrderPaidNotifier orderPaidNotifier;

    private OrderLedgerService orderLedgerService;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
        OrderSettlementService settlementService =
                new OrderSettlementService(orderRepository, paymentRepository, orderPaidNotifier);
        orderLedgerService = new OrderLedgerService(orderRepository, paymentRepository, creditRepository,
                voucherRepository, settlementService, clock);
    }

    private Order order(OrderStatus status, String voucherCode) {
        return Order.builder()
                .orderId(ORDER_ID)
                .conferenceId(CONFERENCE_ID)
                .userId(USER_ID)
                .reference("ORD-TEST0001")
                .status(status)
                .subtotal(new BigDecimal("200.00"))
                .discountAmount(new BigDecimal("40.00"))
                .total(new BigDecimal("160.00"))
                .voucherCode(voucherCode)
                .holdExpiresAt(NOW.plusMinutes(10))
                .createdAt(NOW.minusMinutes(5))
                .build();
    }

    private Credit credit(Long userId, BigDecimal amount, CreditStatus status) {
        return Credit.builder()
                .creditId(CREDIT_ID)
                .userId(userId)
                .conferenceId(CONFERENCE_ID)
                .amount(amount)
                .status(status)
                .createdAt(NOW.minusDays(30))
                .build();
    }

    // ========== 취소 ==========

    @Test
    @DisplayName("취소 - 바우처 사용 반환, 적용된 크레딧 복구")
    void testCancel_ReversesVoucherAndCredit() {
        // Given
        Order order = order(OrderStatus.PENDING, "EARLY");
        Voucher voucher = Voucher.builder()
                .voucherId(7L).conferenceId(CONFERENCE_ID).code("EARLY")
                .voucherType(VoucherType.PERCENTAGE).timesUsed(1).build();
        Payment creditPayment = Payment.succeededCredit(ORDER_ID, CREDIT_ID, new BigDecimal("50.00"), NOW);
        Credit applied = credit(USER_ID, new BigDecimal("50.00"), CreditStatus.APPLIED);

        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(voucherRepository.findByConferenceIdAndCode(CONFERENCE_ID, "EARLY")).thenReturn(Optional.of(voucher));
        when(voucherRepository.decrementUsage(7L)).thenReturn(1);
        when(paymentRepository.findByOrderIdAndMethodAndStatus(ORDER_ID, PaymentMethod.CREDIT, PaymentStatus.SUCCEEDED))
                .thenReturn(List.of(creditPayment));
        when(creditRepository.findByIdForUpdate(CREDIT_ID)).thenReturn(Optional.of(applied));

        // When
        OrderResult result = orderLedgerService.cancelOrder(USER_ID, ORDER_ID);

        // Then
        assertEquals(OrderStatus.CANCELLED, result.getStatus());
        verify(voucherRepository).decrementUsage(7L);
        assertEquals(PaymentStatus.REFUNDED, creditPayment.getStatus());
        assertEquals(CreditStatus.AVAILABLE, applied.getStatus());
        assertNull(applied.getAppliedToOrderId());
    }

    @Test
    @DisplayName("취소 - PAID 주문은 취소할 수 없고 부수 효과도 없다")
    void testCancel_PaidOrderRejected() {
        Order paid = order(OrderStatus.PAID, "EARLY");
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(paid));

        assertThrows(IllegalOrderTransitionException.class, () -> orderLedgerService.cancelOrder(USER_ID, ORDER_ID));

        assertEquals(OrderStatus.PAID, paid.getStatus());
        verifyNoInteractions(voucherRepository, creditRepository);
    }

    @Test
    @DisplayName("취소 - 다른 사용자의 주문은 찾을 수 없음")
    void testCancel_NotOwner() {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, null)));

        assertThrows(OrderNotFoundException.class, () -> orderLedgerService.cancelOrder(999L, ORDER_ID));
    }

    // ========== 크레딧 ==========

    @Test
    @DisplayName("크레딧 일부 적용 - 잔액이 남으면 PENDING 유지")
    void testApplyCredit_Partial() {
        // Given
        Order order = order(OrderStatus.PENDING, null);
        Credit available = credit(USER_ID, new BigDecimal("100.00"), CreditStatus.AVAILABLE);
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(creditRepository.findByIdForUpdate(CREDIT_ID)).thenReturn(Optional.of(available));
        when(paymentRepository.sumSucceededAmount(ORDER_ID))
                .thenReturn(BigDecimal.ZERO, new BigDecimal("100.00"));

        // When
        OrderResult result = orderLedgerService.applyCredit(USER_ID, ORDER_ID, CREDIT_ID);

        // Then
        ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(captor.capture());
        assertEquals(new BigDecimal("100.00"), captor.getValue().getAmount());
        assertEquals(PaymentMethod.CREDIT, captor.getValue().getMethod());

        assertEquals(OrderStatus.PENDING, result.getStatus());
        assertEquals(CreditStatus.APPLIED, available.getStatus());
        assertEquals(ORDER_ID, available.getAppliedToOrderId());
        verify(orderPaidNotifier, never()).notifyPaid(any());
    }

    @Test
    @DisplayName("크레딧이 잔액 이상이면 잔액만큼만 쓰고 주문은 PAID")
    void testApplyCredit_SettlesOrder() {
        // Given
        Order order = order(OrderStatus.PENDING, null);
        Credit available = credit(USER_ID, new BigDecimal("200.00"), CreditStatus.AVAILABLE);
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order));
        when(creditRepository.findByIdForUpdate(CREDIT_ID)).thenReturn(Optional.of(available));
        when(paymentRepository.sumSucceededAmount(ORDER_ID))
                .thenReturn(BigDecimal.ZERO, new BigDecimal("160.00"));

        // When
        OrderResult result = orderLedgerService.applyCredit(USER_ID, ORDER_ID, CREDIT_ID);

        // Then
        ArgumentCaptor<Payment> captor = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(captor.capture());
        assertEquals(new BigDecimal("160.00"), captor.getValue().getAmount());

        assertEquals(OrderStatus.PAID, result.getStatus());
        assertNull(order.getHoldExpiresAt());
        verify(orderPaidNotifier).notifyPaid(order);
    }

    @Test
    @DisplayName("다른 사용자의 크레딧은 적용 불가")
    void testApplyCredit_WrongOwner() {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, null)));
        when(creditRepository.findByIdForUpdate(CREDIT_ID))
                .thenReturn(Optional.of(credit(999L, new BigDecimal("50.00"), CreditStatus.AVAILABLE)));

        RegistrationValidationException ex = assertThrows(RegistrationValidationException.class,
                () -> orderLedgerService.applyCredit(USER_ID, ORDER_ID, CREDIT_ID));

        assertEquals(ErrorCode.CREDIT_NOT_APPLICABLE, ex.getErrorCode());
        verify(paymentRepository, never()).save(any());
    }

    @Test
    @DisplayName("이미 사용된 크레딧은 적용 불가")
    void testApplyCredit_AlreadyApplied() {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.PENDING, null)));
        when(creditRepository.findByIdForUpdate(CREDIT_ID))
                .thenReturn(Optional.of(credit(USER_ID, new BigDecimal("50.00"), CreditStatus.APPLIED)));

        RegistrationValidationException ex = assertThrows(RegistrationValidationException.class,
                () -> orderLedgerService.applyCredit(USER_ID, ORDER_ID, CREDIT_ID));

        assertEquals(ErrorCode.CREDIT_NOT_APPLICABLE, ex.getErrorCode());
    }

    @Test
    @DisplayName("PENDING 이 아닌 주문에는 크레딧 적용 불가")
    void testApplyCredit_NotPending() {
        when(orderRepository.findByIdForUpdate(ORDER_ID)).thenReturn(Optional.of(order(OrderStatus.CANCELLED, null)));

        RegistrationValidationException ex = assertThrows(RegistrationValidationException.class,
                () -> orderLedgerService.applyCredit(USER_ID, ORDER_ID, CREDIT_ID));

        assertEquals(ErrorCode.ORDER_NOT_PENDING, ex.getErrorCode());
        verifyNoInteractions(creditRepository);
    }
}
