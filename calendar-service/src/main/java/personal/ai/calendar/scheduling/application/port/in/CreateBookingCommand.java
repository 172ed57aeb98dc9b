package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.Map;

/**
 * Create Booking Command
 *
 * @param time   HHMM 또는 HH:MM (예약 시 정규화)
 * @param status 초기 상태 (null이면 PENDING)
 */
public record CreateBookingCommand(
        String providerId,
        LocalDate date,
        String time,
        String clientIdentifier,
        Map<String, Object> appointmentDetails,
        BookingStatus status
) {
    public CreateBookingCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date cannot be null");
        }
        if (clientIdentifier == null || clientIdentifier.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Client identifier cannot be null or blank");
        }
        if (appointmentDetails == null) {
            appointmentDetails = Map.of();
        }
        if (status == null) {
            status = BookingStatus.PENDING;
        }
    }

    public static CreateBookingCommand of(String providerId, LocalDate date, String time, String clientIdentifier) {
        return new CreateBookingCommand(providerId, date, time, clientIdentifier, Map.of(), BookingStatus.PENDING);
    }
}
