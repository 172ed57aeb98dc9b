package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.Map;

/**
 * Update Booking Command
 * status, appointmentDetails 중 null인 값은 변경하지 않는다.
 */
public record UpdateBookingCommand(
        String providerId,
        LocalDate date,
        String time,
        BookingStatus status,
        Map<String, Object> appointmentDetails
) {
    public UpdateBookingCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date cannot be null");
        }
    }
}
