package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.RecurringRule;

import java.util.List;
import java.util.Optional;

/**
 * Manage Recurring Rules UseCase (Input Port)
 * 일(day-of-month) 단위 반복 슬롯 규칙 관리
 */
public interface ManageRecurringRulesUseCase {

    /**
     * 규칙 생성 또는 교체
     */
    RecurringRule putRule(PutRecurringRuleCommand command);

    /**
     * 기존 규칙의 슬롯 교체
     *
     * @throws personal.ai.calendar.scheduling.domain.exception.RecurringRuleNotFoundException 규칙이 없을 때
     */
    RecurringRule updateRule(PutRecurringRuleCommand command);

    Optional<RecurringRule> getRule(String providerId, int dayOfMonth);

    List<RecurringRule> listRules(String providerId);

    void deleteRule(String providerId, int dayOfMonth);
}
