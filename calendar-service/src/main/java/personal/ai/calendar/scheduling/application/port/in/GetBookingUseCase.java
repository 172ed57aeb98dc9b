package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.Booking;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Get Booking UseCase (Input Port)
 * 취소된 예약(tombstone)도 함께 조회된다.
 */
public interface GetBookingUseCase {

    Optional<Booking> getBooking(String providerId, LocalDate date, String time);

    List<Booking> listBookingsForDate(String providerId, LocalDate date);

    List<Booking> listBookingsForRange(String providerId, LocalDate startDate, LocalDate endDate);
}
