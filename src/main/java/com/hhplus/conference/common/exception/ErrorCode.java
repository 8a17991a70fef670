package com.hhplus.conference.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_NOT_OPEN, APP_PAYMENT_GATEWAY_ERROR
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Conference / Catalog
    CONFERENCE_NOT_FOUND("DOMAIN_CONFERENCE_NOT_FOUND", "컨퍼런스를 찾을 수 없습니다", 404),
    TICKET_TYPE_NOT_FOUND("DOMAIN_TICKET_TYPE_NOT_FOUND", "티켓 유형을 찾을 수 없습니다", 404),
    ADDON_NOT_FOUND("DOMAIN_ADDON_NOT_FOUND", "애드온을 찾을 수 없습니다", 404),

    // Cart Domain
    CART_NOT_FOUND("DOMAIN_CART_NOT_FOUND", "장바구니를 찾을 수 없습니다", 404),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_NOT_OPEN("DOMAIN_CART_NOT_OPEN", "열려 있는 장바구니가 아닙니다", 400),
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상이어야 합니다", 400),
    SKU_UNAVAILABLE("DOMAIN_CART_SKU_UNAVAILABLE", "현재 구매할 수 없는 상품입니다", 400),
    VOUCHER_REQUIRED("DOMAIN_CART_VOUCHER_REQUIRED", "바우처가 필요한 티켓입니다", 400),
    ADDON_PREREQUISITE_MISSING("DOMAIN_CART_ADDON_PREREQUISITE_MISSING", "애드온에 필요한 티켓이 장바구니에 없습니다", 400),

    // Inventory
    CAPACITY_EXCEEDED("DOMAIN_INVENTORY_CAPACITY_EXCEEDED", "남은 수량이 부족합니다", 400),
    PER_USER_LIMIT_EXCEEDED("DOMAIN_INVENTORY_PER_USER_LIMIT_EXCEEDED", "1인당 구매 한도를 초과했습니다", 400),

    // Voucher
    VOUCHER_NOT_FOUND("DOMAIN_VOUCHER_NOT_FOUND", "바우처 코드를 찾을 수 없습니다", 400),
    INVALID_VOUCHER("DOMAIN_VOUCHER_INVALID", "사용할 수 없는 바우처입니다", 400),

    // Order / Payment / Credit
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    PAYMENT_NOT_FOUND("DOMAIN_PAYMENT_NOT_FOUND", "결제를 찾을 수 없습니다", 404),
    ILLEGAL_ORDER_TRANSITION("DOMAIN_ORDER_ILLEGAL_TRANSITION", "허용되지 않는 주문 상태 전환입니다", 400),
    ORDER_NOT_PENDING("DOMAIN_ORDER_NOT_PENDING", "결제 대기 중인 주문이 아닙니다", 400),
    ORDER_ALREADY_PAID("DOMAIN_ORDER_ALREADY_PAID", "이미 결제가 완료된 주문입니다", 400),
    INVALID_PAYMENT_AMOUNT("DOMAIN_PAYMENT_INVALID_AMOUNT", "유효하지 않은 결제 금액입니다", 400),
    CREDIT_NOT_FOUND("DOMAIN_CREDIT_NOT_FOUND", "크레딧을 찾을 수 없습니다", 404),
    CREDIT_NOT_APPLICABLE("DOMAIN_CREDIT_NOT_APPLICABLE", "사용할 수 없는 크레딧입니다", 400),

    // Webhook
    INVALID_WEBHOOK_SIGNATURE("DOMAIN_WEBHOOK_INVALID_SIGNATURE", "웹훅 서명 검증에 실패했습니다", 400),
    STRIPE_EVENT_NOT_FOUND("DOMAIN_WEBHOOK_EVENT_NOT_FOUND", "웹훅 이벤트를 찾을 수 없습니다", 404),

    // Concurrency race resolved as a validation failure
    CONCURRENT_MODIFICATION("DOMAIN_CONCURRENT_MODIFICATION", "동시 요청과 충돌했습니다. 다시 시도해 주세요", 409),

    // ========== Application Layer Errors (5XX) ==========

    ORDER_REFERENCE_GENERATION_FAILED("APP_ORDER_REFERENCE_GENERATION_FAILED", "주문 번호 생성에 실패했습니다", 500),
    PAYMENT_GATEWAY_ERROR("APP_PAYMENT_GATEWAY_ERROR", "결제 대행사 호출에 실패했습니다", 502),
    PAYMENT_GATEWAY_NOT_CONFIGURED("APP_PAYMENT_GATEWAY_NOT_CONFIGURED", "결제 대행사 설정이 없습니다", 500),

    // ========== System Errors (5XX) ==========

    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
