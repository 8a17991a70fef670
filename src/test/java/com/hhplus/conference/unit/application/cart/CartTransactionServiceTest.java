package com.hhplus.conference.unit.application.cart;

import com.hhplus.conference.application.cart.CartContentsLoader;
import com.hhplus.conference.application.cart.CartTransactionService;
import com.hhplus.conference.application.cart.dto.CartSummary;
import com.hhplus.conference.application.inventory.InventoryLedger;
import com.hhplus.conference.common.exception.BizException;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.cart.Cart;
import com.hhplus.conference.domain.cart.CartItem;
import com.hhplus.conference.domain.cart.CartRepository;
import com.hhplus.conference.domain.cart.CartStatus;
import com.hhplus.conference.domain.catalog.AddOn;
import com.hhplus.conference.domain.catalog.AddOnRepository;
import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.catalog.TicketTypeNotFoundException;
import com.hhplus.conference.domain.catalog.TicketTypeRepository;
import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import com.hhplus.conference.domain.inventory.PerUserLimitExceededException;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.pricing.DiscountCalculator;
import com.hhplus.conference.domain.voucher.Voucher;
import com.hhplus.conference.domain.voucher.VoucherRepository;
import com.hhplus.conference.domain.voucher.VoucherType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CartTransactionServiceTest - 장바구니 변경 트랜잭션 단위 테스트
 *
 * 테스트 대상:
 * - 장바구니 생성 / 만료 처리
 * - 티켓 추가 검증 (수량, 다른 컨퍼런스 상품, 바우처 잠금, 1인 한도)
 * - 잠금 순서 (장바구니 → 컨퍼런스)
 * - 티켓 삭제 시 필요 조건이 사라진 애드온 연쇄 삭제
 * - 바우처 적용 (코드 정규화, 미존재 / 사용 불가 구분)
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("CartTransactionService 단위 테스트")
class CartTransactionServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 6, 1, 10, 0);
    private static final Long USER_ID = 100L;
    private static final Long CONFERENCE_ID = 1L;
    private static final Long CART_ID = 10L;
    private static final String SLUG = "pycon-2025";

    @Mock
    private CartRepository cartRepository;
    @Mock
    private ConferenceRepository conferenceRepository;
    @Mock
    private TicketTypeRepository ticketTypeRepository;
    @Mock
    private AddOnRepository addOnRepository;
    @Mock
    private VoucherRepository voucherRepository;
    @Mock
    private OrderRepository orderRepository;

    private CartTransactionService cartTransactionService;

    private Conference conference;
    private Cart openCart;
    private TicketType general;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
        cartTransactionService = new CartTransactionService(
                cartRepository,
                conferenceRepository,
                ticketTypeRepository,
                addOnRepository,
                voucherRepository,
                orderRepository,
                new InventoryLedger(orderRepository, conferenceRepository),
                new CartContentsLoader(cartRepository, ticketTypeRepository, addOnRepository),
                new DiscountCalculator(),
                new RegistrationProperties(),
                clock);

        conference = Conference.builder()
                .conferenceId(CONFERENCE_ID)
                .slug(SLUG)
                .name("PyCon")
                .active(true)
                .build();
        openCart = Cart.builder()
                .cartId(CART_ID)
                .userId(USER_ID)
                .conferenceId(CONFERENCE_ID)
                .status(CartStatus.OPEN)
                .expiresAt(NOW.plusMinutes(10))
                .createdAt(NOW.minusMinutes(20))
                .updatedAt(NOW.minusMinutes(20))
                .build();
        general = TicketType.builder()
                .id(1L)
                .conferenceId(CONFERENCE_ID)
                .name("General")
                .price(new BigDecimal("100.00"))
                .totalQuantity(0)
                .limitPerUser(3)
                .build();

        when(conferenceRepository.findBySlug(SLUG)).thenReturn(Optional.of(conference));
        when(cartRepository.findOpenCarts(USER_ID, CONFERENCE_ID)).thenReturn(List.of(openCart));
        when(cartRepository.findByIdForUpdate(CART_ID)).thenReturn(Optional.of(openCart));
        when(cartRepository.save(any(Cart.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(cartRepository.saveItem(any(CartItem.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(ticketTypeRepository.findById(1L)).thenReturn(Optional.of(general));
    }

    private CartItem ticketItem(Long itemId, Long ticketTypeId, int quantity) {
        return CartItem.builder()
                .cartItemId(itemId)
                .cartId(CART_ID)
                .ticketTypeId(ticketTypeId)
                .quantity(quantity)
                .createdAt(NOW)
                .build();
    }

    private CartItem addOnItem(Long itemId, Long addOnId, int quantity) {
        return CartItem.builder()
                .cartItemId(itemId)
                .cartId(CART_ID)
                .addOnId(addOnId)
                .quantity(quantity)
                .createdAt(NOW)
                .build();
    }

    // ========== 티켓 추가 ==========

    @Test
    @DisplayName("티켓 추가 - 새 라인 저장 후 미리보기 반환, 만료 시각 연장")
    void testAddTicket_NewLine() {
        // Given
        when(cartRepository.findTicketItemForUpdate(CART_ID, 1L)).thenReturn(Optional.empty());
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of(), List.of(ticketItem(1L, 1L, 2)));

        // When
        CartSummary summary = cartTransactionService.addTicket(USER_ID, SLUG, 1L, 2);

        // Then
        ArgumentCaptor<CartItem> captor = ArgumentCaptor.forClass(CartItem.class);
        verify(cartRepository).saveItem(captor.capture());
        assertEquals(2, captor.getValue().getQuantity());
        assertEquals(1L, captor.getValue().getTicketTypeId());

        assertEquals(new BigDecimal("200.00"), summary.getTotal());
        assertEquals(1, summary.getItems().size());
        assertEquals(NOW.plusMinutes(30), openCart.getExpiresAt());
    }

    @Test
    @DisplayName("티켓 추가 - 기존 라인이 있으면 수량 증가")
    void testAddTicket_ExistingLine() {
        // Given
        CartItem existing = ticketItem(1L, 1L, 1);
        when(cartRepository.findTicketItemForUpdate(CART_ID, 1L)).thenReturn(Optional.of(existing));
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of(existing));

        // When
        cartTransactionService.addTicket(USER_ID, SLUG, 1L, 1);

        // Then
        assertEquals(2, existing.getQuantity());
        verify(cartRepository).saveItem(existing);
    }

    @Test
    @DisplayName("티켓 추가 - 수량 0 은 거부")
    void testAddTicket_InvalidQuantity() {
        RegistrationValidationException ex = assertThrows(RegistrationValidationException.class,
                () -> cartTransactionService.addTicket(USER_ID, SLUG, 1L, 0));

        assertEquals(ErrorCode.INVALID_QUANTITY, ex.getErrorCode());
        verify(cartRepository, never()).saveItem(any());
    }

    @Test
    @DisplayName("티켓 추가 - 다른 컨퍼런스의 티켓 유형은 찾을 수 없음으로 처리")
    void testAddTicket_OtherConference() {
        TicketType foreign = TicketType.builder()
                .id(9L).conferenceId(2L).name("Other").price(BigDecimal.TEN).build();
        when(ticketTypeRepository.findById(9L)).thenReturn(Optional.of(foreign));

        assertThrows(TicketTypeNotFoundException.class,
                () -> cartTransactionService.addTicket(USER_ID, SLUG, 9L, 1));
    }

    @Test
    @DisplayName("티켓 추가 - 바우처 전용 티켓은 잠금 해제 바우처 없이는 거부")
    void testAddTicket_RequiresVoucher() {
        TicketType hidden = TicketType.builder()
                .id(2L).conferenceId(CONFERENCE_ID).name("Speaker").price(BigDecimal.ZERO)
                .requiresVoucher(true).build();
        when(ticketTypeRepository.findById(2L)).thenReturn(Optional.of(hidden));

        RegistrationValidationException ex = assertThrows(RegistrationValidationException.class,
                () -> cartTransactionService.addTicket(USER_ID, SLUG, 2L, 1));
        assertEquals(ErrorCode.VOUCHER_REQUIRED, ex.getErrorCode());
    }

    @Test
    @DisplayName("티켓 추가 - 잠금 해제 바우처가 붙어 있어도 만료됐으면 거부")
    void testAddTicket_RequiresVoucher_ExpiredVoucher() {
        // Given
        TicketType hidden = TicketType.builder()
                .id(2L).conferenceId(CONFERENCE_ID).name("Speaker").price(BigDecimal.ZERO)
                .requiresVoucher(true).build();
        Voucher expired = Voucher.builder()
                .voucherId(7L).conferenceId(CONFERENCE_ID).code("SPEAKER")
                .voucherType(VoucherType.COMP).maxUses(10)
                .unlocksHiddenTickets(true)
                .validUntil(NOW.minusDays(1)).build();
        openCart.attachVoucher(7L, NOW.minusDays(2));
        when(ticketTypeRepository.findById(2L)).thenReturn(Optional.of(hidden));
        when(voucherRepository.findById(7L)).thenReturn(Optional.of(expired));

        // When
        RegistrationValidationException ex = assertThrows(RegistrationValidationException.class,
                () -> cartTransactionService.addTicket(USER_ID, SLUG, 2L, 1));

        // Then
        assertEquals(ErrorCode.VOUCHER_REQUIRED, ex.getErrorCode());
        verify(cartRepository, never()).saveItem(any());
    }

    @Test
    @DisplayName("티켓 추가 - 유효한 잠금 해제 바우처가 있으면 바우처 전용 티켓도 담는다")
    void testAddTicket_RequiresVoucher_Unlocked() {
        // Given
        TicketType hidden = TicketType.builder()
                .id(2L).conferenceId(CONFERENCE_ID).name("Speaker").price(BigDecimal.ZERO)
                .requiresVoucher(true).build();
        Voucher speaker = Voucher.builder()
                .voucherId(7L).conferenceId(CONFERENCE_ID).code("SPEAKER")
                .voucherType(VoucherType.COMP).maxUses(10)
                .unlocksHiddenTickets(true)
                .validUntil(NOW.plusDays(1)).build();
        openCart.attachVoucher(7L, NOW.minusMinutes(5));
        when(ticketTypeRepository.findById(2L)).thenReturn(Optional.of(hidden));
        when(voucherRepository.findById(7L)).thenReturn(Optional.of(speaker));
        when(cartRepository.findTicketItemForUpdate(CART_ID, 2L)).thenReturn(Optional.empty());
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of());

        // When
        cartTransactionService.addTicket(USER_ID, SLUG, 2L, 1);

        // Then
        ArgumentCaptor<CartItem> captor = ArgumentCaptor.forClass(CartItem.class);
        verify(cartRepository).saveItem(captor.capture());
        assertEquals(2L, captor.getValue().getTicketTypeId());
    }

    @Test
    @DisplayName("티켓 추가 - 장바구니 행을 컨퍼런스 행보다 먼저 잠근다")
    void testAddTicket_LocksCartBeforeConference() {
        // Given: 전체 정원이 있는 컨퍼런스
        Conference limited = Conference.builder()
                .conferenceId(CONFERENCE_ID)
                .slug(SLUG)
                .name("PyCon")
                .active(true)
                .totalCapacity(100)
                .build();
        when(conferenceRepository.findBySlug(SLUG)).thenReturn(Optional.of(limited));
        when(conferenceRepository.findByIdForUpdate(CONFERENCE_ID)).thenReturn(Optional.of(limited));
        when(cartRepository.findTicketItemForUpdate(CART_ID, 1L)).thenReturn(Optional.empty());
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of(), List.of(ticketItem(1L, 1L, 1)));

        // When
        cartTransactionService.addTicket(USER_ID, SLUG, 1L, 1);

        // Then
        InOrder inOrder = inOrder(cartRepository, conferenceRepository);
        inOrder.verify(cartRepository).findByIdForUpdate(CART_ID);
        inOrder.verify(cartRepository).findTicketItemForUpdate(CART_ID, 1L);
        inOrder.verify(conferenceRepository).findByIdForUpdate(CONFERENCE_ID);
        inOrder.verify(cartRepository).saveItem(any(CartItem.class));
    }

    @Test
    @DisplayName("수량 변경 - 늘릴 때도 장바구니 행을 컨퍼런스 행보다 먼저 잠근다")
    void testUpdateQuantity_LocksCartBeforeConference() {
        // Given
        Conference limited = Conference.builder()
                .conferenceId(CONFERENCE_ID)
                .slug(SLUG)
                .name("PyCon")
                .active(true)
                .totalCapacity(100)
                .build();
        CartItem ticketLine = ticketItem(1L, 1L, 1);
        when(conferenceRepository.findBySlug(SLUG)).thenReturn(Optional.of(limited));
        when(conferenceRepository.findByIdForUpdate(CONFERENCE_ID)).thenReturn(Optional.of(limited));
        when(cartRepository.findItemById(1L)).thenReturn(Optional.of(ticketLine));
        when(cartRepository.findTicketItemForUpdate(CART_ID, 1L)).thenReturn(Optional.of(ticketLine));
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of(ticketLine));

        // When
        cartTransactionService.updateQuantity(USER_ID, SLUG, 1L, 2);

        // Then
        InOrder inOrder = inOrder(cartRepository, conferenceRepository);
        inOrder.verify(cartRepository).findByIdForUpdate(CART_ID);
        inOrder.verify(conferenceRepository).findByIdForUpdate(CONFERENCE_ID);
        inOrder.verify(cartRepository).saveItem(ticketLine);
        assertEquals(2, ticketLine.getQuantity());
    }

    @Test
    @DisplayName("티켓 추가 - 잠근 장바구니가 사라졌으면 아무것도 담지 않는다")
    void testAddTicket_LockedCartMissing() {
        when(cartRepository.findByIdForUpdate(CART_ID)).thenReturn(Optional.empty());

        BizException ex = assertThrows(BizException.class,
                () -> cartTransactionService.addTicket(USER_ID, SLUG, 1L, 1));

        assertEquals(ErrorCode.CART_NOT_FOUND, ex.getErrorCode());
        verify(cartRepository, never()).saveItem(any());
    }

    @Test
    @DisplayName("티켓 추가 - 장바구니 + 구매 완료 수량이 1인 한도를 넘으면 거부")
    void testAddTicket_PerUserLimit() {
        // Given: 한도 3, 장바구니 2, 구매 완료 1
        when(cartRepository.findTicketItemForUpdate(CART_ID, 1L)).thenReturn(Optional.of(ticketItem(1L, 1L, 2)));
        when(orderRepository.sumPurchasedTicketQuantityByUser(USER_ID, 1L)).thenReturn(1L);

        // When & Then
        assertThrows(PerUserLimitExceededException.class,
                () -> cartTransactionService.addTicket(USER_ID, SLUG, 1L, 1));
        verify(cartRepository, never()).saveItem(any());
    }

    // ========== 장바구니 생성 / 만료 ==========

    @Test
    @DisplayName("만료된 열린 장바구니는 EXPIRED 로 바꾸고 새 장바구니를 만든다")
    void testGetCart_ExpiresStaleCart() {
        // Given
        Cart stale = Cart.builder()
                .cartId(5L).userId(USER_ID).conferenceId(CONFERENCE_ID)
                .status(CartStatus.OPEN).expiresAt(NOW.minusMinutes(1)).build();
        when(cartRepository.findOpenCarts(USER_ID, CONFERENCE_ID)).thenReturn(List.of(stale));
        when(cartRepository.findItems(any())).thenReturn(List.of());

        // When
        CartSummary summary = cartTransactionService.getCart(USER_ID, SLUG);

        // Then
        assertEquals(CartStatus.EXPIRED, stale.getStatus());
        assertEquals(CartStatus.OPEN, summary.getStatus());
        assertEquals(NOW.plusMinutes(30), summary.getExpiresAt());
        verify(cartRepository, times(2)).save(any(Cart.class));
    }

    // ========== 라인 삭제 ==========

    @Test
    @DisplayName("티켓 라인 삭제 - 필요 티켓이 사라진 애드온도 함께 삭제")
    void testRemoveItem_CascadesDependentAddOn() {
        // Given
        CartItem ticketLine = ticketItem(1L, 1L, 1);
        CartItem workshopLine = addOnItem(2L, 5L, 1);
        CartItem tshirtLine = addOnItem(3L, 6L, 1);
        AddOn workshop = AddOn.builder()
                .id(5L).conferenceId(CONFERENCE_ID).name("Workshop").price(new BigDecimal("50.00"))
                .requiredTicketTypeIds(Set.of(1L)).build();
        AddOn tshirt = AddOn.builder()
                .id(6L).conferenceId(CONFERENCE_ID).name("T-shirt").price(new BigDecimal("20.00")).build();
        when(cartRepository.findItemById(1L)).thenReturn(Optional.of(ticketLine));
        when(addOnRepository.findById(5L)).thenReturn(Optional.of(workshop));
        when(addOnRepository.findById(6L)).thenReturn(Optional.of(tshirt));
        when(cartRepository.findItems(CART_ID)).thenReturn(
                List.of(ticketLine, workshopLine, tshirtLine),
                List.of(tshirtLine));

        // When
        CartSummary summary = cartTransactionService.removeItem(USER_ID, SLUG, 1L);

        // Then
        verify(cartRepository).deleteItem(ticketLine);
        verify(cartRepository).deleteItem(workshopLine);
        verify(cartRepository, never()).deleteItem(tshirtLine);
        assertEquals(new BigDecimal("20.00"), summary.getTotal());
    }

    @Test
    @DisplayName("티켓 라인 삭제 - 다른 필요 티켓이 남아 있으면 애드온은 유지")
    void testRemoveItem_KeepsAddOnSatisfiedByOtherTicket() {
        // Given: 워크숍은 티켓 1 또는 2 가 필요, 장바구니에 둘 다 있음
        TicketType vip = TicketType.builder()
                .id(2L).conferenceId(CONFERENCE_ID).name("VIP").price(new BigDecimal("150.00"))
                .totalQuantity(0).limitPerUser(3).build();
        CartItem generalLine = ticketItem(1L, 1L, 1);
        CartItem vipLine = ticketItem(2L, 2L, 1);
        CartItem workshopLine = addOnItem(3L, 5L, 1);
        AddOn workshop = AddOn.builder()
                .id(5L).conferenceId(CONFERENCE_ID).name("Workshop").price(new BigDecimal("50.00"))
                .requiredTicketTypeIds(Set.of(1L, 2L)).build();
        when(ticketTypeRepository.findById(2L)).thenReturn(Optional.of(vip));
        when(cartRepository.findItemById(1L)).thenReturn(Optional.of(generalLine));
        when(addOnRepository.findById(5L)).thenReturn(Optional.of(workshop));
        when(cartRepository.findItems(CART_ID)).thenReturn(
                List.of(generalLine, vipLine, workshopLine),
                List.of(vipLine, workshopLine));

        // When
        CartSummary summary = cartTransactionService.removeItem(USER_ID, SLUG, 1L);

        // Then
        verify(cartRepository).deleteItem(generalLine);
        verify(cartRepository, never()).deleteItem(workshopLine);
        verify(cartRepository, never()).deleteItem(vipLine);
        assertEquals(new BigDecimal("200.00"), summary.getTotal());
    }

    @Test
    @DisplayName("티켓 라인 수량을 0 으로 바꿔도 필요 티켓이 사라진 애드온이 함께 삭제")
    void testUpdateQuantity_ZeroOnTicketCascades() {
        // Given
        CartItem ticketLine = ticketItem(1L, 1L, 2);
        CartItem workshopLine = addOnItem(2L, 5L, 1);
        AddOn workshop = AddOn.builder()
                .id(5L).conferenceId(CONFERENCE_ID).name("Workshop").price(new BigDecimal("50.00"))
                .requiredTicketTypeIds(Set.of(1L)).build();
        when(cartRepository.findItemById(1L)).thenReturn(Optional.of(ticketLine));
        when(addOnRepository.findById(5L)).thenReturn(Optional.of(workshop));
        when(cartRepository.findItems(CART_ID)).thenReturn(
                List.of(ticketLine, workshopLine),
                List.of());

        // When
        CartSummary summary = cartTransactionService.updateQuantity(USER_ID, SLUG, 1L, 0);

        // Then
        verify(cartRepository).deleteItem(ticketLine);
        verify(cartRepository).deleteItem(workshopLine);
        verify(cartRepository, never()).saveItem(any());
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.getTotal()));
    }

    @Test
    @DisplayName("수량 0 으로 변경하면 삭제와 같다")
    void testUpdateQuantity_ZeroDeletes() {
        CartItem tshirtLine = addOnItem(3L, 6L, 2);
        when(cartRepository.findItemById(3L)).thenReturn(Optional.of(tshirtLine));
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of());

        cartTransactionService.updateQuantity(USER_ID, SLUG, 3L, 0);

        verify(cartRepository).deleteItem(tshirtLine);
        verify(cartRepository, never()).saveItem(any());
    }

    // ========== 바우처 ==========

    @Test
    @DisplayName("바우처 적용 - 코드는 대문자로 정규화해 조회, 미리보기에 할인 반영")
    void testApplyVoucher_Normalized() {
        // Given
        Voucher voucher = Voucher.builder()
                .voucherId(7L).conferenceId(CONFERENCE_ID).code("EARLY")
                .voucherType(VoucherType.PERCENTAGE).discountValue(new BigDecimal("20"))
                .maxUses(10).build();
        when(voucherRepository.findByConferenceIdAndCode(CONFERENCE_ID, "EARLY")).thenReturn(Optional.of(voucher));
        when(voucherRepository.findById(7L)).thenReturn(Optional.of(voucher));
        when(cartRepository.findItems(CART_ID)).thenReturn(List.of(ticketItem(1L, 1L, 1)));

        // When
        CartSummary summary = cartTransactionService.applyVoucher(USER_ID, SLUG, " early ");

        // Then
        assertEquals(7L, openCart.getVoucherId());
        assertEquals("EARLY", summary.getVoucherCode());
        assertEquals(new BigDecimal("20.00"), summary.getDiscount());
        assertEquals(new BigDecimal("80.00"), summary.getTotal());
    }

    @Test
    @DisplayName("바우처 적용 - 없는 코드와 소진된 바우처는 서로 다른 오류")
    void testApplyVoucher_UnknownAndExhausted() {
        Voucher exhausted = Voucher.builder()
                .voucherId(8L).conferenceId(CONFERENCE_ID).code("USED")
                .voucherType(VoucherType.COMP).maxUses(1).timesUsed(1).build();
        when(voucherRepository.findByConferenceIdAndCode(CONFERENCE_ID, "NOPE")).thenReturn(Optional.empty());
        when(voucherRepository.findByConferenceIdAndCode(CONFERENCE_ID, "USED")).thenReturn(Optional.of(exhausted));

        BizException unknown = assertThrows(BizException.class,
                () -> cartTransactionService.applyVoucher(USER_ID, SLUG, "nope"));
        BizException invalid = assertThrows(BizException.class,
                () -> cartTransactionService.applyVoucher(USER_ID, SLUG, "used"));

        assertEquals(ErrorCode.VOUCHER_NOT_FOUND, unknown.getErrorCode());
        assertEquals(ErrorCode.INVALID_VOUCHER, invalid.getErrorCode());
        assertNull(openCart.getVoucherId());
    }
}
