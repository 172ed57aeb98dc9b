package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.Booking;

/**
 * Reschedule Booking UseCase (Input Port)
 */
public interface RescheduleBookingUseCase {

    /**
     * 예약을 다른 날짜/시간으로 이동 (createdAt, 상태, 상세 정보 유지)
     *
     * @throws personal.ai.calendar.scheduling.domain.exception.BookingNotFoundException           기존 키에 활성 예약이 없을 때
     * @throws personal.ai.calendar.scheduling.domain.exception.SlotAlreadyBookedException         새 슬롯이 점유된 경우 (원래 예약은 복구됨)
     * @throws personal.ai.calendar.scheduling.domain.exception.BookingCompensationFailedException 복구 실패로 예약이 유실된 경우
     */
    Booking rescheduleBooking(RescheduleBookingCommand command);
}
