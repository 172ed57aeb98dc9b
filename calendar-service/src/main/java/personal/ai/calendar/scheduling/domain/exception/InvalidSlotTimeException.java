package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Invalid Slot Time Exception
 * 슬롯 시간이 HHMM / HH:MM 네 자리로 정규화되지 않을 때 발생
 */
public class InvalidSlotTimeException extends BusinessException {
    public InvalidSlotTimeException(String rawTime) {
        super(ErrorCode.INVALID_SLOT_TIME,
                String.format("Slot time must be HHMM or HH:MM (e.g. 0930): time=%s", rawTime));
    }
}
