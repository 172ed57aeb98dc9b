package personal.ai.calendar.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.calendar.scheduling.application.port.in.ManageRecurringRulesUseCase;
import personal.ai.calendar.scheduling.application.port.in.PutRecurringRuleCommand;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.exception.RecurringRuleNotFoundException;
import personal.ai.calendar.scheduling.domain.model.RecurringRule;
import personal.ai.calendar.scheduling.domain.model.SlotTimes;

import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Recurring Rule Service
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecurringRuleService implements ManageRecurringRulesUseCase {

    private final CalendarRepository calendarRepository;

    @Override
    public RecurringRule putRule(PutRecurringRuleCommand command) {
        List<LocalTime> slots = SlotTimes.parseAll(command.availableSlots());
        RecurringRule saved = calendarRepository.putRule(command.providerId(), command.dayOfMonth(), slots);

        log.info("Recurring rule saved: providerId={}, dayOfMonth={}, slots={}",
                command.providerId(), command.dayOfMonth(), slots.size());
        return saved;
    }

    @Override
    public RecurringRule updateRule(PutRecurringRuleCommand command) {
        List<LocalTime> slots = SlotTimes.parseAll(command.availableSlots());
        if (calendarRepository.getRule(command.providerId(), command.dayOfMonth()).isEmpty()) {
            throw new RecurringRuleNotFoundException(command.providerId(), command.dayOfMonth());
        }
        return calendarRepository.putRule(command.providerId(), command.dayOfMonth(), slots);
    }

    @Override
    public Optional<RecurringRule> getRule(String providerId, int dayOfMonth) {
        RecurringRule.requireValidDayOfMonth(dayOfMonth);
        return calendarRepository.getRule(providerId, dayOfMonth);
    }

    @Override
    public List<RecurringRule> listRules(String providerId) {
        return calendarRepository.listRules(providerId);
    }

    @Override
    public void deleteRule(String providerId, int dayOfMonth) {
        RecurringRule.requireValidDayOfMonth(dayOfMonth);
        calendarRepository.deleteRule(providerId, dayOfMonth);
        log.info("Recurring rule deleted: providerId={}, dayOfMonth={}", providerId, dayOfMonth);
    }
}
