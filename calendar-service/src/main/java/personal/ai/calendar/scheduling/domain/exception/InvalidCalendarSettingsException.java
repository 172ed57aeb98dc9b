package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Invalid Calendar Settings Exception
 * horizonDays, minNoticeHours, dayOfMonth 등 설정 값 범위 위반
 */
public class InvalidCalendarSettingsException extends BusinessException {
    public InvalidCalendarSettingsException(String detail) {
        super(ErrorCode.INVALID_SETTINGS, detail);
    }
}
