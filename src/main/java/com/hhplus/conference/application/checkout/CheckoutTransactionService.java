package com.hhplus.conference.application.checkout;

import com.hhplus.conference.application.cart.CartContents;
import com.hhplus.conference.application.cart.CartContentsLoader;
import com.hhplus.conference.application.checkout.dto.CheckoutCommand;
import com.hhplus.conference.application.inventory.InventoryLedger;
import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.cart.Cart;
import com.hhplus.conference.domain.cart.CartItem;
import com.hhplus.conference.domain.cart.CartNotFoundException;
import com.hhplus.conference.domain.cart.CartRepository;
import com.hhplus.conference.domain.catalog.AddOn;
import com.hhplus.conference.domain.catalog.AddOnNotFoundException;
import com.hhplus.conference.domain.catalog.AddOnRepository;
import com.hhplus.conference.domain.catalog.PurchasableItem;
import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.catalog.TicketTypeNotFoundException;
import com.hhplus.conference.domain.catalog.TicketTypeRepository;
import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceNotFoundException;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderLineItem;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.pricing.DiscountCalculator;
import com.hhplus.conference.domain.pricing.LineDiscount;
import com.hhplus.conference.domain.pricing.LineKind;
import com.hhplus.conference.domain.pricing.PricingLine;
import com.hhplus.conference.domain.pricing.PricingResult;
import com.hhplus.conference.domain.pricing.VoucherTerms;
import com.hhplus.conference.domain.voucher.InvalidVoucherException;
import com.hhplus.conference.domain.voucher.Voucher;
import com.hhplus.conference.domain.voucher.VoucherRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CheckoutTransactionService - 장바구니 → 주문 원자적 전환 (Application 계층)
 *
 * 처리 순서 (하나의 트랜잭션):
 * 1. 장바구니 행 잠금, OPEN / 미만료 / 비어있지 않음 확인
 * 2. 바우처가 있으면 FOR UPDATE 로 다시 읽고 유효성 재확인
 * 3. 모든 라인을 지금 시점 기준으로 재검증 (판매 기간, 재고, 1인 한도, 컨퍼런스 정원)
 * 4. 할인 재계산 (미리보기 결과를 신뢰하지 않음)
 * 5. 주문 번호 생성, PENDING 주문과 라인 스냅샷 저장, 재고 보류 설정
 * 6. 장바구니 CHECKED_OUT
 * 7. 바우처 사용 횟수 원자적 증가 (UPDATE ... SET times_used = times_used + 1)
 *
 * 어느 단계에서든 예외가 나면 전체 롤백되어 부분 주문은 남지 않는다.
 *
 * 동시성 제어:
 * - 상품 행을 id 오름차순으로 잠가 교착을 피한다
 * - 같은 상품을 사는 체크아웃은 잠금 순서대로 직렬화된다
 * - READ COMMITTED: 잠금 획득 이후의 수량 집계가 트랜잭션 시작 시점 스냅샷이 아닌 최신 커밋을 읽도록 한다
 * - 주문 번호 유니크 제약 위반은 한 번 재시도한다
 */
@Slf4j
@Service
public class CheckoutTransactionService {

    private final CartRepository cartRepository;
    private final ConferenceRepository conferenceRepository;
    private final TicketTypeRepository ticketTypeRepository;
    private final AddOnRepository addOnRepository;
    private final VoucherRepository voucherRepository;
    private final OrderRepository orderRepository;
    private final CartContentsLoader cartContentsLoader;
    private final InventoryLedger inventoryLedger;
    private final DiscountCalculator discountCalculator;
    private final OrderReferenceGenerator orderReferenceGenerator;
    private final RegistrationProperties properties;
    private final Clock clock;

    public CheckoutTransactionService(CartRepository cartRepository,
                                      ConferenceRepository conferenceRepository,
                                      TicketTypeRepository ticketTypeRepository,
                                      AddOnRepository addOnRepository,
                                      VoucherRepository voucherRepository,
                                      OrderRepository orderRepository,
                                      CartContentsLoader cartContentsLoader,
                                      InventoryLedger inventoryLedger,
                                      DiscountCalculator discountCalculator,
                                      OrderReferenceGenerator orderReferenceGenerator,
                                      RegistrationProperties properties,
                                      Clock clock) {
        this.cartRepository = cartRepository;
        this.conferenceRepository = conferenceRepository;
        this.ticketTypeRepository = ticketTypeRepository;
        this.addOnRepository = addOnRepository;
        this.voucherRepository = voucherRepository;
        this.orderRepository = orderRepository;
        this.cartContentsLoader = cartContentsLoader;
        this.inventoryLedger = inventoryLedger;
        this.discountCalculator = discountCalculator;
        this.orderReferenceGenerator = orderReferenceGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional(isolation = Isolation.READ_COMMITTED)
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 2)
    public OrderResult checkout(CheckoutCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        Long userId = command.getUserId();
        Conference conference = conferenceRepository.findBySlug(command.getConferenceSlug())
                .filter(Conference::isActive)
                .orElseThrow(() -> new ConferenceNotFoundException(command.getConferenceSlug()));

        Cart cart = lockOpenCart(userId, conference.getConferenceId(), now);
        CartContents contents = cartContentsLoader.load(cart.getCartId());
        if (contents.isEmpty()) {
            throw new RegistrationValidationException(ErrorCode.CART_EMPTY, "cartId=" + cart.getCartId());
        }

        Voucher voucher = lockValidVoucher(cart, now);
        revalidateLines(userId, conference, contents, voucher, now);

        VoucherTerms terms = voucher == null ? null : VoucherTerms.from(voucher);
        PricingResult pricing = discountCalculator.calculate(contents.toPricingLines(), terms);

        BigDecimal subtotal = pricing.getSubtotal().getAmount();
        BigDecimal total = pricing.getTotal().getAmount();
        Order order = Order.createPending(
                conference.getConferenceId(),
                userId,
                orderReferenceGenerator.generate(),
                subtotal,
                subtotal.subtract(total),
                voucher == null ? null : voucher.getCode(),
                terms == null ? null : terms.describe(),
                now.plus(properties.holdDuration()),
                now);
        for (LineDiscount lineDiscount : pricing.getLines()) {
            order.addLineItem(snapshot(lineDiscount, now));
        }
        order.withBilling(command.getBillingName(), command.getBillingEmail(), command.getBillingCompany());
        Order saved = orderRepository.save(order);

        cart.markCheckedOut(now);
        cartRepository.save(cart);

        if (voucher != null && voucherRepository.incrementUsage(voucher.getVoucherId(), now) == 0) {
            throw InvalidVoucherException.notValid(voucher.getCode());
        }

        log.info("[CheckoutTransactionService] 주문 생성 - orderId={}, reference={}, cartId={}, total={}, holdExpiresAt={}",
                saved.getOrderId(), saved.getReference(), cart.getCartId(), saved.getTotal(), saved.getHoldExpiresAt());
        return OrderResult.from(saved);
    }

    private Cart lockOpenCart(Long userId, Long conferenceId, LocalDateTime now) {
        Cart candidate = cartRepository.findOpenCarts(userId, conferenceId).stream()
                .findFirst()
                .orElseThrow(() -> new RegistrationValidationException(ErrorCode.CART_NOT_OPEN,
                        "userId=" + userId + ", conferenceId=" + conferenceId));
        Cart cart = cartRepository.findByIdForUpdate(candidate.getCartId())
                .orElseThrow(() -> new CartNotFoundException(candidate.getCartId()));
        cart.assertOpen(now);
        return cart;
    }

    private Voucher lockValidVoucher(Cart cart, LocalDateTime now) {
        if (!cart.hasVoucher()) {
            return null;
        }
        Voucher voucher = voucherRepository.findByIdForUpdate(cart.getVoucherId())
                .orElseThrow(() -> InvalidVoucherException.notValid("voucherId=" + cart.getVoucherId()));
        if (!voucher.isValid(now)) {
            throw InvalidVoucherException.notValid(voucher.getCode());
        }
        return voucher;
    }

    /**
     * 장바구니에 담을 때의 검증 결과는 신뢰하지 않고 커밋 시점 기준으로 다시 검증한다
     */
    private void revalidateLines(Long userId, Conference conference, CartContents contents,
                                 Voucher voucher, LocalDateTime now) {
        List<CartItem> ticketItems = contents.getItems().stream()
                .filter(CartItem::isTicket)
                .sorted(Comparator.comparing(CartItem::getTicketTypeId))
                .collect(Collectors.toList());
        for (CartItem item : ticketItems) {
            TicketType ticketType = ticketTypeRepository.findByIdForUpdate(item.getTicketTypeId())
                    .orElseThrow(() -> new TicketTypeNotFoundException(item.getTicketTypeId()));
            assertPurchasable(ticketType, now);
            if (ticketType.isRequiresVoucher()
                    && (voucher == null || !voucher.unlocksTicketType(ticketType.getId()))) {
                throw new RegistrationValidationException(ErrorCode.VOUCHER_REQUIRED, ticketType.getName());
            }
            long purchased = orderRepository.sumPurchasedTicketQuantityByUser(userId, ticketType.getId());
            inventoryLedger.validateTicketAdd(ticketType, item.getQuantity(), 0, purchased, now);
        }

        Set<Long> ticketTypeIds = contents.ticketTypeIds();
        List<CartItem> addOnItems = contents.getItems().stream()
                .filter(CartItem::isAddOn)
                .sorted(Comparator.comparing(CartItem::getAddOnId))
                .collect(Collectors.toList());
        for (CartItem item : addOnItems) {
            AddOn addOn = addOnRepository.findByIdForUpdate(item.getAddOnId())
                    .orElseThrow(() -> new AddOnNotFoundException(item.getAddOnId()));
            assertPurchasable(addOn, now);
            if (!addOn.isSatisfiedBy(ticketTypeIds)) {
                throw new RegistrationValidationException(ErrorCode.ADDON_PREREQUISITE_MISSING, addOn.getName());
            }
            inventoryLedger.validateAddOnAdd(addOn, item.getQuantity(), 0, now);
        }

        inventoryLedger.validateGlobalCapacity(conference, contents.ticketQuantity(), now);
    }

    private OrderLineItem snapshot(LineDiscount lineDiscount, LocalDateTime now) {
        PricingLine line = lineDiscount.getLine();
        BigDecimal lineTotal = lineDiscount.getDiscountedTotal().getAmount();
        BigDecimal discount = lineDiscount.getLineTotal().getAmount().subtract(lineTotal);
        return OrderLineItem.snapshot(
                line.getDescription(),
                line.getQuantity(),
                line.getUnitPrice().getAmount(),
                discount,
                lineTotal,
                line.getKind() == LineKind.TICKET ? line.getSkuId() : null,
                line.getKind() == LineKind.ADDON ? line.getSkuId() : null,
                now);
    }

    private void assertPurchasable(PurchasableItem item, LocalDateTime now) {
        if (!item.isActive() || !item.isWithinSalesWindow(now)) {
            throw new RegistrationValidationException(ErrorCode.SKU_UNAVAILABLE, item.getName());
        }
    }
}
