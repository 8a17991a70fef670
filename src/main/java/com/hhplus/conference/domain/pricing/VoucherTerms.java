package com.hhplus.conference.domain.pricing;

import com.hhplus.conference.domain.voucher.Voucher;
import com.hhplus.conference.domain.voucher.VoucherType;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * 할인 계산에 필요한 바우처 조건의 불변 사본
 *
 * 범위 집합이 비어 있으면 해당 종류 전체에 적용된다.
 */
@Getter
public final class VoucherTerms {

    private final String code;
    private final VoucherType type;
    private final BigDecimal value;
    private final Set<Long> ticketTypeIds;
    private final Set<Long> addOnIds;

    public VoucherTerms(String code, VoucherType type, BigDecimal value,
                        Collection<Long> ticketTypeIds, Collection<Long> addOnIds) {
        this.code = code;
        this.type = Objects.requireNonNull(type, "type");
        this.value = value == null ? BigDecimal.ZERO : value;
        this.ticketTypeIds = ticketTypeIds == null ? Set.of() : Set.copyOf(ticketTypeIds);
        this.addOnIds = addOnIds == null ? Set.of() : Set.copyOf(addOnIds);
    }

    public static VoucherTerms from(Voucher voucher) {
        return new VoucherTerms(voucher.getCode(), voucher.getVoucherType(), voucher.getDiscountValue(),
                voucher.getApplicableTicketTypeIds(), voucher.getApplicableAddOnIds());
    }

    public boolean appliesTo(PricingLine line) {
        Set<Long> scope = line.getKind() == LineKind.TICKET ? ticketTypeIds : addOnIds;
        return scope.isEmpty() || scope.contains(line.getSkuId());
    }

    /**
     * 주문에 남기는 스냅샷 문자열 (예: "PERCENTAGE:20.00")
     */
    public String describe() {
        return type.name() + ":" + value.setScale(2, java.math.RoundingMode.HALF_UP).toPlainString();
    }
}
