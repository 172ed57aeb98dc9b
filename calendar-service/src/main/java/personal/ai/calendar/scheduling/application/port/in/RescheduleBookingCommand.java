package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Reschedule Booking Command
 */
public record RescheduleBookingCommand(
        String providerId,
        LocalDate oldDate,
        String oldTime,
        LocalDate newDate,
        String newTime
) {
    public RescheduleBookingCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (oldDate == null || newDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking dates cannot be null");
        }
    }
}
