package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.RecurringRule;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.util.List;

/**
 * Put Recurring Rule Command
 *
 * @param availableSlots HHMM 또는 HH:MM 형식 시간 목록 (UTC)
 */
public record PutRecurringRuleCommand(
        String providerId,
        int dayOfMonth,
        List<String> availableSlots
) {
    public PutRecurringRuleCommand {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        RecurringRule.requireValidDayOfMonth(dayOfMonth);
        availableSlots = availableSlots == null ? List.of() : List.copyOf(availableSlots);
    }
}
