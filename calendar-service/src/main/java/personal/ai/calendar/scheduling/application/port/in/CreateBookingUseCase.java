package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.Booking;

/**
 * Create Booking UseCase (Input Port)
 */
public interface CreateBookingUseCase {

    /**
     * 슬롯 예약
     * 저장소의 원자적 조건부 삽입으로 중복 예약을 막는다.
     * 네트워크 오류 등 결과가 불확실한 실패 후에는 재시도 전에 getBooking으로 먼저 확인해야 한다.
     * (첫 시도가 실제로 성공했다면 재시도는 충돌로 보고된다)
     *
     * @return 저장된 예약
     * @throws personal.ai.calendar.scheduling.domain.exception.InvalidSlotTimeException   시간 형식 오류
     * @throws personal.ai.calendar.scheduling.domain.exception.SlotAlreadyBookedException 같은 날짜/시간에 이미 행이 있을 때
     */
    Booking createBooking(CreateBookingCommand command);
}
