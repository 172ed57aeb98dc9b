package personal.ai.calendar.scheduling.domain.service;

import org.springframework.stereotype.Component;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.CalendarDates;
import personal.ai.calendar.scheduling.domain.model.CalendarSnapshot;
import personal.ai.calendar.scheduling.domain.model.DateOverride;
import personal.ai.calendar.scheduling.domain.model.DayAvailability;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;
import personal.ai.calendar.scheduling.domain.model.RecurringRule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Availability Calculator (Domain Service)
 * 설정, 규칙, 예외 설정, 예약으로부터 날짜별 예약 가능 슬롯을 계산하는 순수 함수
 *
 * 날짜별 처리 순서:
 * 1. hardCutoffDate 이후 날짜 제외
 * 2. BLOCKED 예외 설정 -> 제외, MODIFIED -> overrideSlots가 기본 슬롯 (규칙 슬롯과 병합하지 않음)
 * 3. 예외 설정이 없으면 해당 일(day-of-month)의 규칙 슬롯
 * 4. 활성(PENDING, CONFIRMED) 예약 슬롯 제거
 * 5. now + minNoticeHours 이하에 시작하는 슬롯 제거 (경계값 제외)
 * 6. 남은 슬롯이 있는 날짜만 오름차순으로 반환
 */
@Component
public class AvailabilityCalculator {

    public List<DayAvailability> calculate(CalendarSnapshot snapshot,
                                           LocalDate startDate,
                                           LocalDate endDate,
                                           Instant now) {
        GlobalSettings settings = snapshot.settings();

        Map<Integer, List<LocalTime>> ruleSlotsByDay = snapshot.rules().stream()
                .collect(Collectors.toMap(RecurringRule::dayOfMonth, RecurringRule::availableSlots, (a, b) -> b));
        Map<LocalDate, DateOverride> overridesByDate = snapshot.overrides().stream()
                .collect(Collectors.toMap(DateOverride::date, Function.identity(), (a, b) -> b));
        Map<LocalDate, Set<LocalTime>> bookedByDate = snapshot.bookings().stream()
                .filter(Booking::isActive)
                .collect(Collectors.groupingBy(Booking::date,
                        Collectors.mapping(Booking::time, Collectors.toSet())));

        Instant noticeBoundary = settings.requiresNotice() ? settings.noticeBoundary(now) : null;

        List<DayAvailability> result = new ArrayList<>();
        for (LocalDate date : CalendarDates.daysBetween(startDate, endDate)) {
            if (settings.isBeyondCutoff(date)) {
                continue;
            }

            DateOverride override = overridesByDate.get(date);
            if (override != null && override.isBlocked()) {
                continue;
            }
            List<LocalTime> baseSlots = override != null
                    ? override.overrideSlots()
                    : ruleSlotsByDay.getOrDefault(date.getDayOfMonth(), List.of());

            Set<LocalTime> taken = bookedByDate.getOrDefault(date, Set.of());
            List<LocalTime> open = baseSlots.stream()
                    .filter(slot -> !taken.contains(slot))
                    .filter(slot -> noticeBoundary == null || startsAfter(date, slot, noticeBoundary))
                    .distinct()
                    .sorted()
                    .toList();

            if (!open.isEmpty()) {
                result.add(new DayAvailability(date, open));
            }
        }
        return result;
    }

    private boolean startsAfter(LocalDate date, LocalTime slot, Instant boundary) {
        return date.atTime(slot).toInstant(ZoneOffset.UTC).isAfter(boundary);
    }
}
