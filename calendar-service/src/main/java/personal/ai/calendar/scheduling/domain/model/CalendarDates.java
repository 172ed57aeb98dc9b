package personal.ai.calendar.scheduling.domain.model;

import personal.ai.calendar.scheduling.domain.exception.InvalidDateException;

import java.time.LocalDate;
import java.util.List;

/**
 * 날짜 범위 유틸리티 (UTC 단일 달력 기준)
 */
public final class CalendarDates {

    private CalendarDates() {
    }

    /**
     * 조회 범위 검증 (startDate <= endDate)
     */
    public static void requireOrderedRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new InvalidDateException(startDate, endDate);
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidDateException(startDate, endDate);
        }
    }

    /**
     * [startDate, endDate] 양 끝 포함 날짜 목록
     */
    public static List<LocalDate> daysBetween(LocalDate startDate, LocalDate endDate) {
        requireOrderedRange(startDate, endDate);
        return startDate.datesUntil(endDate.plusDays(1)).toList();
    }
}
