package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Slot Already Booked Exception
 * 조건부 삽입(insert-if-absent)이 기존 예약 키와 충돌한 경우
 * 호출자는 다른 슬롯을 선택해야 하며, 엔진은 재시도하지 않는다.
 */
public class SlotAlreadyBookedException extends BusinessException {
    public SlotAlreadyBookedException(String providerId, LocalDate date, LocalTime time) {
        super(ErrorCode.SLOT_ALREADY_BOOKED,
                String.format("Slot already booked: providerId=%s, date=%s, time=%s", providerId, date, time));
    }
}
