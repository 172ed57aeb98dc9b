package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.OverrideType;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.List;

/**
 * Update Date Override Command
 * null 필드는 변경하지 않는다.
 */
public record UpdateDateOverrideCommand(
        String providerId,
        LocalDate date,
        OverrideType type,
        List<String> overrideSlots
) {
    public UpdateDateOverrideCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override date cannot be null");
        }
        overrideSlots = overrideSlots == null ? null : List.copyOf(overrideSlots);
    }
}
