package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Date Override Not Found Exception
 */
public class DateOverrideNotFoundException extends BusinessException {
    public DateOverrideNotFoundException(String providerId, LocalDate date) {
        super(ErrorCode.OVERRIDE_NOT_FOUND,
                String.format("Date override not found: providerId=%s, date=%s", providerId, date));
    }
}
