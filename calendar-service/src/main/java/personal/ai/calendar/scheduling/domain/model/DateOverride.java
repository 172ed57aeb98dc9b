package personal.ai.calendar.scheduling.domain.model;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Date Override Domain Model
 * 특정 날짜 하루에만 적용되는 예외 설정 (불변)
 */
public record DateOverride(
        String providerId,
        LocalDate date,
        OverrideType type,
        List<LocalTime> overrideSlots,
        Instant createdAt,
        Instant updatedAt) {

    public DateOverride {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override date cannot be null");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override type cannot be null");
        }
        overrideSlots = overrideSlots == null
                ? List.of()
                : overrideSlots.stream().distinct().sorted().toList();
    }

    public boolean isBlocked() {
        return type == OverrideType.BLOCKED;
    }
}
