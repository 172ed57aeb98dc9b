package personal.ai.calendar.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.calendar.scheduling.application.port.in.GetAvailabilityUseCase;
import personal.ai.calendar.scheduling.application.port.in.ManageSettingsUseCase;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.model.CalendarDates;
import personal.ai.calendar.scheduling.domain.model.CalendarSnapshot;
import personal.ai.calendar.scheduling.domain.model.DayAvailability;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;
import personal.ai.calendar.scheduling.domain.service.AvailabilityCalculator;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Availability Query Service
 * 저장소에서 설정/규칙/예외 설정/예약을 읽어 AvailabilityCalculator에 위임
 *
 * 조회 전용이며 결과는 캐시하지 않는다. (설정이 없으면 기본 설정 생성은 발생)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityQueryService implements GetAvailabilityUseCase {

    private final ManageSettingsUseCase manageSettingsUseCase;
    private final CalendarRepository calendarRepository;
    private final AvailabilityCalculator availabilityCalculator;
    private final Clock clock;

    @Override
    public List<DayAvailability> getAvailability(String providerId, LocalDate startDate, LocalDate endDate) {
        CalendarDates.requireOrderedRange(startDate, endDate);

        GlobalSettings settings = manageSettingsUseCase.getOrCreateSettings(providerId);
        CalendarSnapshot snapshot = new CalendarSnapshot(
                settings,
                calendarRepository.listRules(providerId),
                calendarRepository.listOverrides(providerId, startDate, endDate),
                calendarRepository.listBookingsForRange(providerId, startDate, endDate));

        List<DayAvailability> availability =
                availabilityCalculator.calculate(snapshot, startDate, endDate, clock.instant());

        log.debug("Availability calculated: providerId={}, range={}~{}, days={}",
                providerId, startDate, endDate, availability.size());
        return availability;
    }
}
