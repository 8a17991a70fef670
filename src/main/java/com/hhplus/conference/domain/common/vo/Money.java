package com.hhplus.conference.domain.common.vo;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Set;

/**
 * Money Value Object
 *
 * 단일 통화 금액을 소수점 둘째 자리(ROUND_HALF_UP)로 표현하는 값 객체입니다.
 *
 * 사용처:
 * - DiscountCalculator (라인별 할인 분배)
 * - Order / OrderLineItem (금액 스냅샷)
 * - Stripe 금액 변환 (최소 화폐 단위 ↔ 소수 금액)
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 모든 연산 결과는 scale 2로 정규화
 * - 음수는 허용하지 않음 (잔액 계산은 호출자가 max(…, 0) 처리)
 */
public final class Money implements Comparable<Money>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * 최소 화폐 단위가 곧 기본 단위인 통화 (Stripe zero-decimal currencies)
     */
    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of(
            "BIF", "CLP", "DJF", "GNF", "JPY", "KMF", "KRW", "MGA",
            "PYG", "RWF", "UGX", "VND", "VUV", "XAF", "XOF", "XPF");

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING);
    }

    /**
     * @throws IllegalArgumentException amount가 null이거나 음수인 경우
     */
    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount는 null이 될 수 없습니다");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("금액은 음수가 될 수 없습니다: " + amount);
        }
        return new Money(amount);
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    /**
     * Stripe 최소 화폐 단위 정수를 금액으로 변환
     *
     * zero-decimal 통화는 그대로, 그 외 통화는 100으로 나눈다.
     */
    public static Money fromMinorUnits(long minorUnits, String currency) {
        BigDecimal value = BigDecimal.valueOf(minorUnits);
        if (!isZeroDecimal(currency)) {
            value = value.divide(HUNDRED, SCALE, ROUNDING);
        }
        return of(value);
    }

    public static boolean isZeroDecimal(String currency) {
        return currency != null && ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase());
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public long toMinorUnits(String currency) {
        BigDecimal value = isZeroDecimal(currency) ? amount : amount.multiply(HUNDRED);
        return value.setScale(0, ROUNDING).longValueExact();
    }

    public Money add(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return new Money(this.amount.add(other.amount));
    }

    /**
     * @throws IllegalArgumentException 결과가 음수가 되는 경우
     */
    public Money subtract(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return of(this.amount.subtract(other.amount));
    }

    /**
     * 0 미만이 되는 뺄셈은 0으로 고정
     */
    public Money subtractFloorZero(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        BigDecimal result = this.amount.subtract(other.amount);
        return result.signum() < 0 ? ZERO : new Money(result);
    }

    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("배수는 음수가 될 수 없습니다: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * 퍼센트 적용 (예: 20 → 20%), 결과는 ROUND_HALF_UP
     */
    public Money percent(BigDecimal percentage) {
        Objects.requireNonNull(percentage, "percentage는 null이 될 수 없습니다");
        return of(this.amount.multiply(percentage).divide(HUNDRED, SCALE, ROUNDING));
    }

    /**
     * this × numerator / denominator 비례 배분, 결과는 ROUND_HALF_UP
     */
    public Money proportion(Money numerator, Money denominator) {
        if (denominator.isZero()) {
            throw new IllegalArgumentException("분모가 0인 비례 배분은 할 수 없습니다");
        }
        return of(this.amount.multiply(numerator.amount).divide(denominator.amount, SCALE, ROUNDING));
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money)) return false;
        return amount.compareTo(((Money) o).amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
