package personal.ai.calendar.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.calendar.scheduling.application.port.in.CancelBookingUseCase;
import personal.ai.calendar.scheduling.application.port.in.CreateBookingCommand;
import personal.ai.calendar.scheduling.application.port.in.CreateBookingUseCase;
import personal.ai.calendar.scheduling.application.port.in.GetBookingUseCase;
import personal.ai.calendar.scheduling.application.port.in.RescheduleBookingCommand;
import personal.ai.calendar.scheduling.application.port.in.RescheduleBookingUseCase;
import personal.ai.calendar.scheduling.application.port.in.UpdateBookingCommand;
import personal.ai.calendar.scheduling.application.port.in.UpdateBookingUseCase;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.CalendarDates;
import personal.ai.calendar.scheduling.domain.model.SlotTimes;
import personal.ai.calendar.scheduling.domain.service.BookingTransactionManager;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Booking Service
 * 시간 문자열 정규화 후 BookingTransactionManager에 위임
 *
 * 예약 생성 시 가용성(규칙/예외 설정/최소 사전 예약 시간)은 검사하지 않는다.
 * 호출자는 getAvailability로 조회한 슬롯만 예약하도록 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements CreateBookingUseCase, RescheduleBookingUseCase,
        CancelBookingUseCase, UpdateBookingUseCase, GetBookingUseCase {

    private final BookingTransactionManager bookingTransactionManager;
    private final CalendarRepository calendarRepository;

    @Override
    public Booking createBooking(CreateBookingCommand command) {
        LocalTime time = SlotTimes.parse(command.time());
        Booking request = Booking.request(command.providerId(), command.date(), time,
                command.clientIdentifier(), command.appointmentDetails(), command.status());

        Booking saved = bookingTransactionManager.create(request);
        log.info("Booking created: providerId={}, date={}, time={}, status={}",
                saved.providerId(), saved.date(), SlotTimes.format(saved.time()), saved.status());
        return saved;
    }

    @Override
    public Booking rescheduleBooking(RescheduleBookingCommand command) {
        LocalTime oldTime = SlotTimes.parse(command.oldTime());
        LocalTime newTime = SlotTimes.parse(command.newTime());

        Booking moved = bookingTransactionManager.reschedule(
                command.providerId(), command.oldDate(), oldTime, command.newDate(), newTime);
        log.info("Booking rescheduled: providerId={}, from={} {}, to={} {}",
                command.providerId(), command.oldDate(), SlotTimes.format(oldTime),
                moved.date(), SlotTimes.format(moved.time()));
        return moved;
    }

    @Override
    public Optional<Booking> cancelBooking(String providerId, LocalDate date, String time) {
        LocalTime slot = SlotTimes.parse(time);
        Optional<Booking> cancelled = bookingTransactionManager.cancel(providerId, date, slot);
        cancelled.ifPresent(b -> log.info("Booking cancelled: providerId={}, date={}, time={}",
                providerId, date, SlotTimes.format(slot)));
        return cancelled;
    }

    @Override
    public Booking updateBooking(UpdateBookingCommand command) {
        LocalTime time = SlotTimes.parse(command.time());
        Booking updated = bookingTransactionManager.update(command.providerId(), command.date(), time,
                command.status(), command.appointmentDetails());
        log.info("Booking updated: providerId={}, date={}, time={}, status={}",
                updated.providerId(), updated.date(), SlotTimes.format(updated.time()), updated.status());
        return updated;
    }

    @Override
    public Optional<Booking> getBooking(String providerId, LocalDate date, String time) {
        return calendarRepository.getBooking(providerId, date, SlotTimes.parse(time));
    }

    @Override
    public List<Booking> listBookingsForDate(String providerId, LocalDate date) {
        return calendarRepository.listBookingsForDate(providerId, date);
    }

    @Override
    public List<Booking> listBookingsForRange(String providerId, LocalDate startDate, LocalDate endDate) {
        CalendarDates.requireOrderedRange(startDate, endDate);
        return calendarRepository.listBookingsForRange(providerId, startDate, endDate);
    }
}
