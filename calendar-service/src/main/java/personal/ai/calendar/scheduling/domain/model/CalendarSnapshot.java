package personal.ai.calendar.scheduling.domain.model;

import java.util.List;

/**
 * 가용성 계산 입력: 한 제공자의 설정, 규칙, 조회 범위의 예외 설정과 예약
 */
public record CalendarSnapshot(
        GlobalSettings settings,
        List<RecurringRule> rules,
        List<DateOverride> overrides,
        List<Booking> bookings) {

    public CalendarSnapshot {
        rules = List.copyOf(rules);
        overrides = List.copyOf(overrides);
        bookings = List.copyOf(bookings);
    }
}
