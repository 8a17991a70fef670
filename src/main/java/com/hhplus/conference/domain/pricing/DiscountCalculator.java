package com.hhplus.conference.domain.pricing;

import com.hhplus.conference.domain.common.vo.Money;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * DiscountCalculator - 순수 할인 계산 도메인 서비스
 *
 * 역할:
 * - (장바구니 라인, 바우처) → 라인별 할인과 합계
 * - DB 접근, 부수효과 없음. 같은 입력이면 항상 같은 결과
 *
 * 할인 규칙:
 * - COMP: 적용 대상 라인 전액 할인
 * - PERCENTAGE: 라인마다 독립적으로 round_half_up(lineTotal × pct / 100)
 * - FIXED_AMOUNT: budget = min(value, 적용 대상 합계) 를 비례 배분하고
 *   마지막 적용 라인은 남은 budget 을 그대로 가져가 반올림 오차를 흡수한다
 *   (할인 합계는 항상 budget 과 정확히 같다)
 */
public class DiscountCalculator {

    /**
     * @param lines   장바구니 라인 (순서가 곧 배분 순서)
     * @param voucher 바우처 조건, 없으면 null
     */
    public PricingResult calculate(List<PricingLine> lines, VoucherTerms voucher) {
        Money subtotal = Money.ZERO;
        for (PricingLine line : lines) {
            subtotal = subtotal.add(line.lineTotal());
        }

        Map<PricingLine, Money> discounts = new HashMap<>();
        if (voucher != null) {
            List<PricingLine> applicable = new ArrayList<>();
            for (PricingLine line : lines) {
                if (voucher.appliesTo(line)) {
                    applicable.add(line);
                }
            }
            switch (voucher.getType()) {
                case COMP:
                    applicable.forEach(line -> discounts.put(line, line.lineTotal()));
                    break;
                case PERCENTAGE:
                    applicable.forEach(line -> discounts.put(line, line.lineTotal().percent(voucher.getValue())));
                    break;
                case FIXED_AMOUNT:
                    distributeFixedAmount(applicable, Money.of(voucher.getValue()), discounts);
                    break;
                default:
                    throw new IllegalStateException("지원하지 않는 바우처 유형: " + voucher.getType());
            }
        }

        List<LineDiscount> results = new ArrayList<>(lines.size());
        Money totalDiscount = Money.ZERO;
        for (PricingLine line : lines) {
            Money discount = discounts.getOrDefault(line, Money.ZERO);
            results.add(new LineDiscount(line, discount));
            totalDiscount = totalDiscount.add(discount);
        }
        return new PricingResult(results, subtotal, totalDiscount);
    }

    private void distributeFixedAmount(List<PricingLine> applicable, Money value, Map<PricingLine, Money> discounts) {
        if (applicable.isEmpty()) {
            return;
        }
        Money applicableSubtotal = Money.ZERO;
        for (PricingLine line : applicable) {
            applicableSubtotal = applicableSubtotal.add(line.lineTotal());
        }
        Money budget = value.min(applicableSubtotal);
        Money remaining = budget;

        for (int i = 0; i < applicable.size(); i++) {
            PricingLine line = applicable.get(i);
            boolean last = i == applicable.size() - 1;
            Money share;
            if (last || applicableSubtotal.isZero()) {
                share = remaining;
            } else {
                share = budget.proportion(line.lineTotal(), applicableSubtotal).min(remaining);
            }
            discounts.put(line, share);
            remaining = remaining.subtract(share);
        }
    }
}
