package com.hhplus.conference.application.cart;

import com.hhplus.conference.application.cart.dto.CartSummary;
import com.hhplus.conference.application.inventory.InventoryLedger;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.cart.Cart;
import com.hhplus.conference.domain.cart.CartItem;
import com.hhplus.conference.domain.cart.CartItemNotFoundException;
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
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.pricing.DiscountCalculator;
import com.hhplus.conference.domain.pricing.PricingResult;
import com.hhplus.conference.domain.pricing.VoucherTerms;
import com.hhplus.conference.domain.voucher.InvalidVoucherException;
import com.hhplus.conference.domain.voucher.Voucher;
import com.hhplus.conference.domain.voucher.VoucherRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * CartTransactionService - 장바구니 변경 트랜잭션 (Application 계층)
 *
 * 역할:
 * - CartService 에서 분리된 트랜잭션 경계
 * - 열린 장바구니 확보, 라인 추가/수정/삭제, 바우처 적용
 * - 모든 변경 후 만료 시각을 now + ttl 로 연장
 *
 * 동시성 제어:
 * - 변경 작업은 장바구니 행을 먼저 잠그고, 컨퍼런스 행(전체 정원)은 마지막에 잠근다
 * - 기존 라인은 FOR UPDATE 로 잠근 뒤 증가
 * - 같은 상품을 동시에 처음 담으면 (cart_id, sku) 유니크 제약 위반이 발생한다.
 *   트랜잭션 전체를 롤백하고 한 번 더 실행하면 두 번째 시도에서는 기존 라인을 잠그고 증가한다.
 * - @Retryable 이 @Transactional 바깥에서 동작하므로 재시도마다 새 트랜잭션이 열린다
 */
@Slf4j
@Service
public class CartTransactionService {

    private final CartRepository cartRepository;
    private final ConferenceRepository conferenceRepository;
    private final TicketTypeRepository ticketTypeRepository;
    private final AddOnRepository addOnRepository;
    private final VoucherRepository voucherRepository;
    private final OrderRepository orderRepository;
    private final InventoryLedger inventoryLedger;
    private final CartContentsLoader cartContentsLoader;
    private final DiscountCalculator discountCalculator;
    private final RegistrationProperties properties;
    private final Clock clock;

    public CartTransactionService(CartRepository cartRepository,
                                  ConferenceRepository conferenceRepository,
                                  TicketTypeRepository ticketTypeRepository,
                                  AddOnRepository addOnRepository,
                                  VoucherRepository voucherRepository,
                                  OrderRepository orderRepository,
                                  InventoryLedger inventoryLedger,
                                  CartContentsLoader cartContentsLoader,
                                  DiscountCalculator discountCalculator,
                                  RegistrationProperties properties,
                                  Clock clock) {
        this.cartRepository = cartRepository;
        this.conferenceRepository = conferenceRepository;
        this.ticketTypeRepository = ticketTypeRepository;
        this.addOnRepository = addOnRepository;
        this.voucherRepository = voucherRepository;
        this.orderRepository = orderRepository;
        this.inventoryLedger = inventoryLedger;
        this.cartContentsLoader = cartContentsLoader;
        this.discountCalculator = discountCalculator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 열린 장바구니 조회 또는 생성 후 요약 반환
     */
    @Transactional
    public CartSummary getCart(Long userId, String conferenceSlug) {
        LocalDateTime now = LocalDateTime.now(clock);
        Conference conference = findConference(conferenceSlug);
        Cart cart = getOrCreateOpenCart(userId, conference.getConferenceId(), now);
        return summarize(cart, now);
    }

    /**
     * 티켓 추가
     *
     * 검증 순서: 수량 → 판매 가능 여부 → 바우처 잠금 해제 → 티켓 재고 / 1인 한도 → 컨퍼런스 정원
     */
    @Transactional
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 2)
    public CartSummary addTicket(Long userId, String conferenceSlug, Long ticketTypeId, int quantity) {
        LocalDateTime now = LocalDateTime.now(clock);
        validateQuantity(quantity);
        Conference conference = findConference(conferenceSlug);
        Cart cart = lockOpenCart(userId, conference.getConferenceId(), now);

        TicketType ticketType = ticketTypeRepository.findById(ticketTypeId)
                .filter(tt -> tt.getConferenceId().equals(conference.getConferenceId()))
                .orElseThrow(() -> new TicketTypeNotFoundException(ticketTypeId));
        assertPurchasable(ticketType, now);
        assertVoucherUnlocks(cart, ticketType, now);

        Optional<CartItem> existing = cartRepository.findTicketItemForUpdate(cart.getCartId(), ticketTypeId);
        long alreadyInCart = existing.map(CartItem::getQuantity).orElse(0);
        long alreadyPurchased = orderRepository.sumPurchasedTicketQuantityByUser(userId, ticketTypeId);
        inventoryLedger.validateTicketAdd(ticketType, quantity, alreadyInCart, alreadyPurchased, now);

        CartContents contents = cartContentsLoader.load(cart.getCartId());
        inventoryLedger.validateGlobalCapacity(conference, contents.ticketQuantity() + quantity, now);

        if (existing.isPresent()) {
            CartItem item = existing.get();
            item.increaseQuantity(quantity);
            cartRepository.saveItem(item);
        } else {
            cartRepository.saveItem(CartItem.forTicket(cart.getCartId(), ticketTypeId, quantity, now));
        }
        touch(cart, now);

        log.info("[CartTransactionService] 티켓 추가 - cartId={}, ticketTypeId={}, quantity={}",
                cart.getCartId(), ticketTypeId, quantity);
        return summarize(cart, now);
    }

    /**
     * 애드온 추가
     *
     * 필요 티켓 유형이 지정된 애드온은 그 중 하나 이상이 장바구니에 있어야 한다.
     */
    @Transactional
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 2)
    public CartSummary addAddOn(Long userId, String conferenceSlug, Long addOnId, int quantity) {
        LocalDateTime now = LocalDateTime.now(clock);
        validateQuantity(quantity);
        Conference conference = findConference(conferenceSlug);
        Cart cart = lockOpenCart(userId, conference.getConferenceId(), now);

        AddOn addOn = addOnRepository.findById(addOnId)
                .filter(ao -> ao.getConferenceId().equals(conference.getConferenceId()))
                .orElseThrow(() -> new AddOnNotFoundException(addOnId));
        assertPurchasable(addOn, now);

        CartContents contents = cartContentsLoader.load(cart.getCartId());
        if (!addOn.isSatisfiedBy(contents.ticketTypeIds())) {
            throw new RegistrationValidationException(ErrorCode.ADDON_PREREQUISITE_MISSING, addOn.getName());
        }

        Optional<CartItem> existing = cartRepository.findAddOnItemForUpdate(cart.getCartId(), addOnId);
        long alreadyInCart = existing.map(CartItem::getQuantity).orElse(0);
        inventoryLedger.validateAddOnAdd(addOn, quantity, alreadyInCart, now);

        if (existing.isPresent()) {
            CartItem item = existing.get();
            item.increaseQuantity(quantity);
            cartRepository.saveItem(item);
        } else {
            cartRepository.saveItem(CartItem.forAddOn(cart.getCartId(), addOnId, quantity, now));
        }
        touch(cart, now);

        log.info("[CartTransactionService] 애드온 추가 - cartId={}, addOnId={}, quantity={}",
                cart.getCartId(), addOnId, quantity);
        return summarize(cart, now);
    }

    /**
     * 라인 삭제
     *
     * 티켓 라인을 지우면 남은 티켓 중 어떤 것도 필요 조건을 채우지 못하는 애드온 라인도 함께 지운다.
     */
    @Transactional
    public CartSummary removeItem(Long userId, String conferenceSlug, Long cartItemId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Conference conference = findConference(conferenceSlug);
        Cart cart = lockOpenCart(userId, conference.getConferenceId(), now);
        CartItem item = findOwnedItem(cart, cartItemId);

        deleteWithCascade(cart, item);
        touch(cart, now);
        return summarize(cart, now);
    }

    /**
     * 라인 수량 변경
     *
     * 0 이하면 삭제와 같다. 늘어나는 경우 증가분만큼 재고 / 한도를 다시 검증한다.
     */
    @Transactional
    public CartSummary updateQuantity(Long userId, String conferenceSlug, Long cartItemId, int newQuantity) {
        LocalDateTime now = LocalDateTime.now(clock);
        Conference conference = findConference(conferenceSlug);
        Cart cart = lockOpenCart(userId, conference.getConferenceId(), now);
        CartItem found = findOwnedItem(cart, cartItemId);

        if (newQuantity <= 0) {
            deleteWithCascade(cart, found);
            touch(cart, now);
            return summarize(cart, now);
        }

        CartItem item = (found.isTicket()
                ? cartRepository.findTicketItemForUpdate(cart.getCartId(), found.getTicketTypeId())
                : cartRepository.findAddOnItemForUpdate(cart.getCartId(), found.getAddOnId()))
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
        int delta = newQuantity - item.getQuantity();

        if (delta > 0) {
            if (item.isTicket()) {
                TicketType ticketType = ticketTypeRepository.findById(item.getTicketTypeId())
                        .orElseThrow(() -> new TicketTypeNotFoundException(item.getTicketTypeId()));
                assertPurchasable(ticketType, now);
                long alreadyPurchased = orderRepository.sumPurchasedTicketQuantityByUser(userId, ticketType.getId());
                inventoryLedger.validateTicketAdd(ticketType, delta, item.getQuantity(), alreadyPurchased, now);
                CartContents contents = cartContentsLoader.load(cart.getCartId());
                inventoryLedger.validateGlobalCapacity(conference, contents.ticketQuantity() + delta, now);
            } else {
                AddOn addOn = addOnRepository.findById(item.getAddOnId())
                        .orElseThrow(() -> new AddOnNotFoundException(item.getAddOnId()));
                assertPurchasable(addOn, now);
                inventoryLedger.validateAddOnAdd(addOn, delta, item.getQuantity(), now);
            }
        }

        item.changeQuantity(newQuantity);
        cartRepository.saveItem(item);
        touch(cart, now);

        log.info("[CartTransactionService] 수량 변경 - cartId={}, cartItemId={}, quantity={}",
                cart.getCartId(), cartItemId, newQuantity);
        return summarize(cart, now);
    }

    /**
     * 바우처 적용 (코드는 대소문자 구분 없이 조회)
     *
     * @throws InvalidVoucherException 코드가 없거나 사용할 수 없는 바우처
     */
    @Transactional
    public CartSummary applyVoucher(Long userId, String conferenceSlug, String code) {
        LocalDateTime now = LocalDateTime.now(clock);
        Conference conference = findConference(conferenceSlug);
        Cart cart = lockOpenCart(userId, conference.getConferenceId(), now);

        String normalized = Voucher.normalizeCode(code);
        Voucher voucher = voucherRepository.findByConferenceIdAndCode(conference.getConferenceId(), normalized)
                .orElseThrow(() -> InvalidVoucherException.unknownCode(code));
        if (!voucher.isValid(now)) {
            throw InvalidVoucherException.notValid(voucher.getCode());
        }

        cart.attachVoucher(voucher.getVoucherId(), now);
        touch(cart, now);

        log.info("[CartTransactionService] 바우처 적용 - cartId={}, voucherCode={}", cart.getCartId(), voucher.getCode());
        return summarize(cart, now);
    }

    /**
     * 만료된 열린 장바구니를 EXPIRED 로 바꾼 뒤 남은 열린 장바구니를 반환, 없으면 새로 만든다
     */
    Cart getOrCreateOpenCart(Long userId, Long conferenceId, LocalDateTime now) {
        Cart open = null;
        for (Cart cart : cartRepository.findOpenCarts(userId, conferenceId)) {
            if (cart.isExpired(now)) {
                cart.expire(now);
                cartRepository.save(cart);
                log.debug("[CartTransactionService] 만료 장바구니 정리 - cartId={}", cart.getCartId());
            } else if (open == null) {
                open = cart;
            }
        }
        if (open != null) {
            open.assertOpen(now);
            return open;
        }
        Cart created = cartRepository.save(Cart.open(userId, conferenceId, now, properties.cartTtl()));
        log.info("[CartTransactionService] 장바구니 생성 - cartId={}, userId={}, conferenceId={}",
                created.getCartId(), userId, conferenceId);
        return created;
    }

    /**
     * 변경 작업용: 장바구니 행을 가장 먼저 잠근다.
     * 체크아웃과 같은 순서(장바구니 → 상품 → 컨퍼런스)를 지켜 교착을 피한다.
     */
    private Cart lockOpenCart(Long userId, Long conferenceId, LocalDateTime now) {
        Cart cart = getOrCreateOpenCart(userId, conferenceId, now);
        Cart locked = cartRepository.findByIdForUpdate(cart.getCartId())
                .orElseThrow(() -> new CartNotFoundException(cart.getCartId()));
        locked.assertOpen(now);
        return locked;
    }

    private void deleteWithCascade(Cart cart, CartItem item) {
        cartRepository.deleteItem(item);
        log.info("[CartTransactionService] 라인 삭제 - cartId={}, cartItemId={}", cart.getCartId(), item.getCartItemId());
        if (!item.isTicket()) {
            return;
        }

        List<CartItem> remaining = cartRepository.findItems(cart.getCartId());
        Set<Long> remainingTicketTypeIds = new HashSet<>();
        for (CartItem other : remaining) {
            if (other.isTicket() && !other.getCartItemId().equals(item.getCartItemId())) {
                remainingTicketTypeIds.add(other.getTicketTypeId());
            }
        }
        for (CartItem other : remaining) {
            if (!other.isAddOn()) {
                continue;
            }
            Optional<AddOn> addOn = addOnRepository.findById(other.getAddOnId());
            if (addOn.isPresent() && !addOn.get().isSatisfiedBy(remainingTicketTypeIds)) {
                cartRepository.deleteItem(other);
                log.info("[CartTransactionService] 필요 티켓이 사라진 애드온 삭제 - cartId={}, addOnId={}",
                        cart.getCartId(), other.getAddOnId());
            }
        }
    }

    private CartSummary summarize(Cart cart, LocalDateTime now) {
        CartContents contents = cartContentsLoader.load(cart.getCartId());
        Voucher voucher = null;
        if (cart.hasVoucher()) {
            voucher = voucherRepository.findById(cart.getVoucherId())
                    .filter(v -> v.isValid(now))
                    .orElse(null);
        }
        VoucherTerms terms = voucher == null ? null : VoucherTerms.from(voucher);
        PricingResult pricing = discountCalculator.calculate(contents.toPricingLines(), terms);
        return CartSummary.of(cart, voucher == null ? null : voucher.getCode(), pricing);
    }

    private void touch(Cart cart, LocalDateTime now) {
        cart.extendExpiry(now, properties.cartTtl());
        cartRepository.save(cart);
    }

    private CartItem findOwnedItem(Cart cart, Long cartItemId) {
        return cartRepository.findItemById(cartItemId)
                .filter(item -> item.getCartId().equals(cart.getCartId()))
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));
    }

    /**
     * 만료 / 소진된 바우처는 잠금 해제에 쓰지 않는다 (미리보기 할인과 같은 기준)
     */
    private void assertVoucherUnlocks(Cart cart, TicketType ticketType, LocalDateTime now) {
        if (!ticketType.isRequiresVoucher()) {
            return;
        }
        boolean unlocked = cart.hasVoucher() && voucherRepository.findById(cart.getVoucherId())
                .filter(voucher -> voucher.isValid(now))
                .map(voucher -> voucher.unlocksTicketType(ticketType.getId()))
                .orElse(false);
        if (!unlocked) {
            throw new RegistrationValidationException(ErrorCode.VOUCHER_REQUIRED, ticketType.getName());
        }
    }

    private void assertPurchasable(PurchasableItem item, LocalDateTime now) {
        if (!item.isActive() || !item.isWithinSalesWindow(now)) {
            throw new RegistrationValidationException(ErrorCode.SKU_UNAVAILABLE, item.getName());
        }
    }

    private void validateQuantity(int quantity) {
        if (quantity < 1) {
            throw new RegistrationValidationException(ErrorCode.INVALID_QUANTITY, "quantity=" + quantity);
        }
    }

    private Conference findConference(String conferenceSlug) {
        return conferenceRepository.findBySlug(conferenceSlug)
                .filter(Conference::isActive)
                .orElseThrow(() -> new ConferenceNotFoundException(conferenceSlug));
    }
}
