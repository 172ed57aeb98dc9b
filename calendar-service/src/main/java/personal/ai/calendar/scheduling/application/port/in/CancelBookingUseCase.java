package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.Booking;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Cancel Booking UseCase (Input Port)
 */
public interface CancelBookingUseCase {

    /**
     * 예약 취소 (soft delete: status -> CANCELLED, 멱등)
     *
     * @return 취소된 예약, 해당 키에 예약이 없으면 empty (오류 아님)
     */
    Optional<Booking> cancelBooking(String providerId, LocalDate date, String time);
}
