package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.exception.InvalidCalendarSettingsException;
import personal.ai.calendar.scheduling.domain.model.SettingsChanges;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Update Settings Command
 * null 필드는 변경하지 않는다.
 */
public record UpdateSettingsCommand(
        String providerId,
        Integer horizonDays,
        Integer minNoticeHours,
        LocalDate hardCutoffDate
) {
    public UpdateSettingsCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (horizonDays != null && horizonDays < 1) {
            throw new InvalidCalendarSettingsException(
                    String.format("horizonDays must be >= 1: horizonDays=%d", horizonDays));
        }
        if (minNoticeHours != null && minNoticeHours < 0) {
            throw new InvalidCalendarSettingsException(
                    String.format("minNoticeHours must be >= 0: minNoticeHours=%d", minNoticeHours));
        }
    }

    public SettingsChanges toChanges() {
        return new SettingsChanges(horizonDays, minNoticeHours, hardCutoffDate);
    }
}
