package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Invalid Booking State Exception
 * 허용되지 않은 상태 전이 (예: CANCELLED -> CONFIRMED)
 */
public class InvalidBookingStateException extends BusinessException {
    public InvalidBookingStateException(BookingStatus currentStatus, BookingStatus targetStatus) {
        super(ErrorCode.INVALID_BOOKING_STATE,
                String.format("예약 상태를 %s에서 %s(으)로 변경할 수 없습니다.", currentStatus, targetStatus));
    }

    public InvalidBookingStateException(String detail) {
        super(ErrorCode.INVALID_BOOKING_STATE, detail);
    }
}
