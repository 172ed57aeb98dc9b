package personal.ai.calendar.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.calendar.scheduling.application.port.in.ManageDateOverridesUseCase;
import personal.ai.calendar.scheduling.application.port.in.PutDateOverrideCommand;
import personal.ai.calendar.scheduling.application.port.in.UpdateDateOverrideCommand;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.exception.DateOverrideNotFoundException;
import personal.ai.calendar.scheduling.domain.model.CalendarDates;
import personal.ai.calendar.scheduling.domain.model.DateOverride;
import personal.ai.calendar.scheduling.domain.model.OverrideType;
import personal.ai.calendar.scheduling.domain.model.SlotTimes;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Date Override Service
 * BLOCKED는 슬롯 목록을 저장하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DateOverrideService implements ManageDateOverridesUseCase {

    private final CalendarRepository calendarRepository;

    @Override
    public DateOverride putOverride(PutDateOverrideCommand command) {
        List<LocalTime> slots = slotsFor(command.type(), SlotTimes.parseAll(command.overrideSlots()));
        DateOverride saved = calendarRepository.putOverride(command.providerId(), command.date(), command.type(), slots);

        log.info("Date override saved: providerId={}, date={}, type={}, slots={}",
                command.providerId(), command.date(), command.type(), slots.size());
        return saved;
    }

    @Override
    public DateOverride updateOverride(UpdateDateOverrideCommand command) {
        DateOverride existing = calendarRepository.getOverride(command.providerId(), command.date())
                .orElseThrow(() -> new DateOverrideNotFoundException(command.providerId(), command.date()));

        OverrideType type = command.type() != null ? command.type() : existing.type();
        List<LocalTime> slots = command.overrideSlots() != null
                ? SlotTimes.parseAll(command.overrideSlots())
                : existing.overrideSlots();

        return calendarRepository.putOverride(command.providerId(), command.date(), type, slotsFor(type, slots));
    }

    @Override
    public Optional<DateOverride> getOverride(String providerId, LocalDate date) {
        return calendarRepository.getOverride(providerId, date);
    }

    @Override
    public List<DateOverride> listOverrides(String providerId, LocalDate startDate, LocalDate endDate) {
        CalendarDates.requireOrderedRange(startDate, endDate);
        return calendarRepository.listOverrides(providerId, startDate, endDate);
    }

    @Override
    public void deleteOverride(String providerId, LocalDate date) {
        calendarRepository.deleteOverride(providerId, date);
        log.info("Date override deleted: providerId={}, date={}", providerId, date);
    }

    private List<LocalTime> slotsFor(OverrideType type, List<LocalTime> slots) {
        return type == OverrideType.BLOCKED ? List.of() : slots;
    }
}
