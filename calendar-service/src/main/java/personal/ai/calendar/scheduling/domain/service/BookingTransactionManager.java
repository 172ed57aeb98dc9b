package personal.ai.calendar.scheduling.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.application.port.out.WriteCondition;
import personal.ai.calendar.scheduling.domain.exception.BookingCompensationFailedException;
import personal.ai.calendar.scheduling.domain.exception.BookingNotFoundException;
import personal.ai.calendar.scheduling.domain.exception.SlotAlreadyBookedException;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.BookingStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

/**
 * Booking Domain Service (Transaction Manager)
 * 예약 생성/이동/취소/수정의 다단계 쓰기를 담당
 *
 * 저장소의 원자적 조건부 삽입만이 동시성 보호 수단이며, 프로세스 내 락이나 상태는 두지 않는다.
 * 이동(delete + insert)과 수정(read-modify-write)은 단계 간 원자성이 없다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionManager {

    private final CalendarRepository calendarRepository;

    /**
     * 예약 생성 (조건부 삽입)
     *
     * @throws SlotAlreadyBookedException 같은 키에 행이 이미 있을 때 (부수 효과 없음)
     */
    public Booking create(Booking request) {
        return calendarRepository.putBooking(request, WriteCondition.MUST_NOT_EXIST);
    }

    /**
     * 예약 이동
     * 1. 기존 활성 예약 조회 (createdAt, 예약자, 상세 정보, 상태 유지)
     * 2. 기존 키 삭제
     * 3. 새 키에 조건부 삽입
     * 4. 삽입 실패 시 기존 키에 원본을 무조건 재삽입(보상) 후 원래 예외 전파
     *
     * @throws BookingNotFoundException           기존 키에 활성 예약이 없을 때
     * @throws SlotAlreadyBookedException         새 키가 이미 점유된 경우 (보상 완료 후)
     * @throws BookingCompensationFailedException 보상 재삽입까지 실패하여 예약이 유실된 경우
     */
    public Booking reschedule(String providerId,
                              LocalDate oldDate, LocalTime oldTime,
                              LocalDate newDate, LocalTime newTime) {
        Booking original = calendarRepository.getBooking(providerId, oldDate, oldTime)
                .filter(Booking::isActive)
                .orElseThrow(() -> new BookingNotFoundException(providerId, oldDate, oldTime));

        if (original.isAt(newDate, newTime)) {
            log.debug("Reschedule target equals current slot: providerId={}, date={}, time={}",
                    providerId, oldDate, oldTime);
            return original;
        }

        calendarRepository.deleteBooking(providerId, oldDate, oldTime);

        try {
            return calendarRepository.putBooking(original.moveTo(newDate, newTime), WriteCondition.MUST_NOT_EXIST);

        } catch (SlotAlreadyBookedException e) {
            log.warn("Reschedule target already booked, restoring original: providerId={}, from={} {}, to={} {}",
                    providerId, oldDate, oldTime, newDate, newTime);
            restore(original, e);
            throw e;

        } catch (RuntimeException e) {
            log.error("Reschedule insert failed, restoring original: providerId={}, from={} {}, to={} {}",
                    providerId, oldDate, oldTime, newDate, newTime, e);
            restore(original, e);
            throw e;
        }
    }

    /**
     * 예약 취소 (soft delete, 멱등)
     *
     * @return 취소된 예약, 해당 키에 예약이 없으면 empty
     */
    public Optional<Booking> cancel(String providerId, LocalDate date, LocalTime time) {
        Optional<Booking> existing = calendarRepository.getBooking(providerId, date, time);
        if (existing.isEmpty()) {
            log.debug("No booking to cancel: providerId={}, date={}, time={}", providerId, date, time);
            return Optional.empty();
        }

        Booking booking = existing.get();
        if (!booking.isActive()) {
            log.debug("Booking already cancelled: providerId={}, date={}, time={}", providerId, date, time);
            return Optional.of(booking);
        }

        return Optional.of(calendarRepository.putBooking(booking.cancel(), WriteCondition.NONE));
    }

    /**
     * 예약 상태/상세 정보 수정
     * 조건 없는 read-modify-write: 동시 수정은 직렬화되지 않으며 마지막 쓰기가 반영된다.
     *
     * @param status  변경할 상태 (null이면 유지)
     * @param details 변경할 상세 정보 (null이면 유지)
     * @throws BookingNotFoundException 예약이 없을 때
     */
    public Booking update(String providerId, LocalDate date, LocalTime time,
                          BookingStatus status, Map<String, Object> details) {
        Booking booking = calendarRepository.getBooking(providerId, date, time)
                .orElseThrow(() -> new BookingNotFoundException(providerId, date, time));

        Booking updated = booking;
        if (status != null) {
            updated = updated.changeStatus(status);
        }
        if (details != null) {
            updated = updated.withDetails(details);
        }
        return calendarRepository.putBooking(updated, WriteCondition.NONE);
    }

    private void restore(Booking original, RuntimeException failure) {
        try {
            calendarRepository.putBooking(original, WriteCondition.NONE);
            log.info("Reschedule compensated: providerId={}, date={}, time={}",
                    original.providerId(), original.date(), original.time());

        } catch (RuntimeException compensationFailure) {
            log.error("FATAL: reschedule compensation failed, booking missing from both keys: "
                            + "providerId={}, date={}, time={}, client={}, status={}, createdAt={}",
                    original.providerId(), original.date(), original.time(),
                    original.clientIdentifier(), original.status(), original.createdAt(), compensationFailure);
            BookingCompensationFailedException fatal =
                    new BookingCompensationFailedException(original, compensationFailure);
            fatal.addSuppressed(failure);
            throw fatal;
        }
    }
}
