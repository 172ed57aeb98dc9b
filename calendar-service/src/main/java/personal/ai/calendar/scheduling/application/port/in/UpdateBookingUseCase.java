package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.Booking;

/**
 * Update Booking UseCase (Input Port)
 */
public interface UpdateBookingUseCase {

    /**
     * 예약 상태 / 상세 정보 변경
     * 버전 검사 없는 read-modify-write로, 같은 예약에 대한 동시 수정은 마지막 쓰기가 반영된다.
     *
     * @throws personal.ai.calendar.scheduling.domain.exception.BookingNotFoundException      예약이 없을 때
     * @throws personal.ai.calendar.scheduling.domain.exception.InvalidBookingStateException 허용되지 않은 상태 전이
     */
    Booking updateBooking(UpdateBookingCommand command);
}
