package personal.ai.calendar.scheduling.domain.model;

import personal.ai.calendar.scheduling.domain.exception.InvalidCalendarSettingsException;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/**
 * Recurring Rule Domain Model
 * 매월 같은 일(day-of-month)에 반복 적용되는 기본 슬롯 목록 (불변)
 * 슬롯은 중복 제거 후 오름차순으로 보관한다.
 */
public record RecurringRule(
        String providerId,
        int dayOfMonth,
        List<LocalTime> availableSlots,
        Instant createdAt,
        Instant updatedAt) {

    public static final int MIN_DAY_OF_MONTH = 1;
    public static final int MAX_DAY_OF_MONTH = 31;

    public RecurringRule {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        requireValidDayOfMonth(dayOfMonth);
        availableSlots = availableSlots == null
                ? List.of()
                : availableSlots.stream().distinct().sorted().toList();
    }

    public static void requireValidDayOfMonth(int dayOfMonth) {
        if (dayOfMonth < MIN_DAY_OF_MONTH || dayOfMonth > MAX_DAY_OF_MONTH) {
            throw new InvalidCalendarSettingsException(
                    String.format("dayOfMonth must be between 1 and 31: dayOfMonth=%d", dayOfMonth));
        }
    }
}
