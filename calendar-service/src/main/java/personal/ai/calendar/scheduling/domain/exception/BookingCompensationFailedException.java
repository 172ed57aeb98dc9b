package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Booking Compensation Failed Exception
 * 예약 이동(reschedule) 실패 후 원래 키로의 복구마저 실패한 경우.
 * 예약이 기존/신규 키 어디에도 남아있지 않으므로 일반 충돌이 아닌 데이터 유실로 취급한다.
 */
public class BookingCompensationFailedException extends BusinessException {

    private final transient Booking lostBooking;

    public BookingCompensationFailedException(Booking lostBooking, Throwable cause) {
        super(ErrorCode.BOOKING_DATA_LOST,
                String.format("Reschedule compensation failed, booking lost: providerId=%s, date=%s, time=%s, client=%s",
                        lostBooking.providerId(), lostBooking.date(), lostBooking.time(), lostBooking.clientIdentifier()),
                cause);
        this.lostBooking = lostBooking;
    }

    /**
     * 유실된 예약 원본 (수동 복구용)
     */
    public Booking getLostBooking() {
        return lostBooking;
    }
}
