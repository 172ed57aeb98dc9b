package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Booking Not Found Exception
 * 해당 날짜/시간에 (활성) 예약이 없을 때 발생
 */
public class BookingNotFoundException extends BusinessException {
    public BookingNotFoundException(String providerId, LocalDate date, LocalTime time) {
        super(ErrorCode.BOOKING_NOT_FOUND,
                String.format("Booking not found: providerId=%s, date=%s, time=%s", providerId, date, time));
    }
}
