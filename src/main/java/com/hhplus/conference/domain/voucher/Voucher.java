package com.hhplus.conference.domain.voucher;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Voucher - 할인 / 숨김 티켓 해제 코드
 *
 * 비즈니스 규칙:
 * - 코드는 컨퍼런스 내에서 유일하며 대문자로 저장, 조회는 대소문자 무시
 * - timesUsed ≤ maxUses 는 항상 유지 (증가는 가드 조건이 붙은 단일 UPDATE로만 수행)
 * - applicableTicketTypeIds / applicableAddOnIds 가 비어 있으면 전체 적용
 */
@Entity
@Table(name = "vouchers",
        uniqueConstraints = @UniqueConstraint(name = "uk_voucher_conference_code",
                columnNames = {"conference_id", "code"}))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Voucher {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "voucher_id")
    private Long voucherId;

    @Column(name = "conference_id", nullable = false)
    private Long conferenceId;

    @Column(name = "code", nullable = false, length = 100)
    private String code;

    @Column(name = "voucher_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private VoucherType voucherType;

    @Column(name = "discount_value", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal discountValue = BigDecimal.ZERO;

    @Column(name = "max_uses", nullable = false)
    @Builder.Default
    private int maxUses = 1;

    @Column(name = "times_used", nullable = false)
    private int timesUsed;

    @Column(name = "valid_from")
    private LocalDateTime validFrom;

    @Column(name = "valid_until")
    private LocalDateTime validUntil;

    @Column(name = "unlocks_hidden_tickets", nullable = false)
    private boolean unlocksHiddenTickets;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "voucher_ticket_types", joinColumns = @JoinColumn(name = "voucher_id"))
    @Column(name = "ticket_type_id")
    @Builder.Default
    private Set<Long> applicableTicketTypeIds = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "voucher_addons", joinColumns = @JoinColumn(name = "voucher_id"))
    @Column(name = "addon_id")
    @Builder.Default
    private Set<Long> applicableAddOnIds = new HashSet<>();

    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * 현재 사용 가능한지 확인: 활성, 잔여 사용 횟수, 유효 기간
     */
    public boolean isValid(LocalDateTime now) {
        if (!active) {
            return false;
        }
        if (timesUsed >= maxUses) {
            return false;
        }
        if (validFrom != null && now.isBefore(validFrom)) {
            return false;
        }
        return validUntil == null || !now.isAfter(validUntil);
    }

    /**
     * requiresVoucher 티켓을 열 수 있는지 확인
     */
    public boolean unlocksTicketType(Long ticketTypeId) {
        if (!unlocksHiddenTickets) {
            return false;
        }
        return applicableTicketTypeIds.isEmpty() || applicableTicketTypeIds.contains(ticketTypeId);
    }
}
