package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.OverrideType;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;
import java.util.List;

/**
 * Put Date Override Command
 *
 * @param overrideSlots MODIFIED일 때 해당 날짜의 전체 슬롯 목록 (규칙 슬롯과 병합되지 않음)
 */
public record PutDateOverrideCommand(
        String providerId,
        LocalDate date,
        OverrideType type,
        List<String> overrideSlots
) {
    public PutDateOverrideCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override date cannot be null");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Override type cannot be null");
        }
        overrideSlots = overrideSlots == null ? List.of() : List.copyOf(overrideSlots);
    }

    public static PutDateOverrideCommand blocked(String providerId, LocalDate date) {
        return new PutDateOverrideCommand(providerId, date, OverrideType.BLOCKED, List.of());
    }

    public static PutDateOverrideCommand modified(String providerId, LocalDate date, List<String> slots) {
        return new PutDateOverrideCommand(providerId, date, OverrideType.MODIFIED, slots);
    }
}
