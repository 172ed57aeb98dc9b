package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

/**
 * Recurring Rule Not Found Exception
 */
public class RecurringRuleNotFoundException extends BusinessException {
    public RecurringRuleNotFoundException(String providerId, int dayOfMonth) {
        super(ErrorCode.RULE_NOT_FOUND,
                String.format("Recurring rule not found: providerId=%s, dayOfMonth=%d", providerId, dayOfMonth));
    }
}
