package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Settings Not Found Exception
 * 아직 생성되지 않은 캘린더 설정을 수정하려 할 때 발생
 */
public class SettingsNotFoundException extends BusinessException {
    public SettingsNotFoundException(String providerId) {
        super(ErrorCode.SETTINGS_NOT_FOUND,
                String.format("Calendar settings not found: providerId=%s", providerId));
    }
}
