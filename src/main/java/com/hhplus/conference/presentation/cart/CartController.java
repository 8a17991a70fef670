package com.hhplus.conference.presentation.cart;

import com.hhplus.conference.application.cart.CartService;
import com.hhplus.conference.presentation.cart.request.AddAddOnRequest;
import com.hhplus.conference.presentation.cart.request.AddTicketRequest;
import com.hhplus.conference.presentation.cart.request.ApplyVoucherRequest;
import com.hhplus.conference.presentation.cart.request.UpdateQuantityRequest;
import com.hhplus.conference.presentation.cart.response.CartResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CartController - Presentation 계층
 *
 * 모든 응답은 변경 후 장바구니의 가격 미리보기다.
 */
@RestController
@RequestMapping("/conferences/{slug}/cart")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    /**
     * GET /conferences/{slug}/cart - 장바구니 조회 (없으면 새로 만든다)
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug) {
        return ResponseEntity.ok(CartResponse.from(cartService.getCart(userId, slug)));
    }

    /**
     * POST /conferences/{slug}/cart/tickets - 티켓 담기
     */
    @PostMapping("/tickets")
    public ResponseEntity<CartResponse> addTicket(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug,
            @Valid @RequestBody AddTicketRequest request) {
        return ResponseEntity.ok(CartResponse.from(
                cartService.addTicket(userId, slug, request.getTicketTypeId(), request.getQuantity())));
    }

    /**
     * POST /conferences/{slug}/cart/addons - 애드온 담기
     */
    @PostMapping("/addons")
    public ResponseEntity<CartResponse> addAddOn(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug,
            @Valid @RequestBody AddAddOnRequest request) {
        return ResponseEntity.ok(CartResponse.from(
                cartService.addAddOn(userId, slug, request.getAddOnId(), request.getQuantity())));
    }

    /**
     * PUT /conferences/{slug}/cart/items/{item_id} - 수량 변경
     */
    @PutMapping("/items/{item_id}")
    public ResponseEntity<CartResponse> updateQuantity(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug,
            @PathVariable("item_id") Long itemId,
            @Valid @RequestBody UpdateQuantityRequest request) {
        return ResponseEntity.ok(CartResponse.from(
                cartService.updateQuantity(userId, slug, itemId, request.getQuantity())));
    }

    /**
     * DELETE /conferences/{slug}/cart/items/{item_id} - 항목 삭제 (의존 애드온도 함께 삭제)
     */
    @DeleteMapping("/items/{item_id}")
    public ResponseEntity<CartResponse> removeItem(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug,
            @PathVariable("item_id") Long itemId) {
        return ResponseEntity.ok(CartResponse.from(cartService.removeItem(userId, slug, itemId)));
    }

    /**
     * POST /conferences/{slug}/cart/voucher - 바우처 적용
     */
    @PostMapping("/voucher")
    public ResponseEntity<CartResponse> applyVoucher(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("slug") String slug,
            @Valid @RequestBody ApplyVoucherRequest request) {
        return ResponseEntity.ok(CartResponse.from(cartService.applyVoucher(userId, slug, request.getCode())));
    }
}
