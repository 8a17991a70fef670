package com.hhplus.conference.domain.inventory;

import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import lombok.Getter;

/**
 * 요청 수량이 남은 재고(티켓 유형, 애드온, 컨퍼런스 전체 정원)를 넘을 때
 */
@Getter
public class CapacityExceededException extends RegistrationValidationException {

    private final long remaining;

    public CapacityExceededException(String itemName, long remaining, long requested) {
        super(ErrorCode.CAPACITY_EXCEEDED,
                "'" + itemName + "' 남은 수량 " + Math.max(remaining, 0) + "개, 요청 " + requested + "개");
        this.remaining = remaining;
    }
}
