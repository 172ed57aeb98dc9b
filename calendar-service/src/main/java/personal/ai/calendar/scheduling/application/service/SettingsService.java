package personal.ai.calendar.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.ai.calendar.scheduling.application.config.CalendarProperties;
import personal.ai.calendar.scheduling.application.port.in.ManageSettingsUseCase;
import personal.ai.calendar.scheduling.application.port.in.UpdateSettingsCommand;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.exception.SettingsNotFoundException;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;

/**
 * Settings Service
 * 제공자별 예약 정책 조회/변경
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService implements ManageSettingsUseCase {

    private final CalendarRepository calendarRepository;
    private final CalendarProperties calendarProperties;

    @Override
    public GlobalSettings getOrCreateSettings(String providerId) {
        return calendarRepository.getSettings(providerId)
                .orElseGet(() -> createDefaults(providerId));
    }

    @Override
    public GlobalSettings updateSettings(UpdateSettingsCommand command) {
        GlobalSettings updated = calendarRepository.updateSettings(command.providerId(), command.toChanges())
                .orElseThrow(() -> new SettingsNotFoundException(command.providerId()));

        log.info("Calendar settings updated: providerId={}, horizonDays={}, minNoticeHours={}, hardCutoffDate={}",
                updated.providerId(), updated.horizonDays(), updated.minNoticeHours(), updated.hardCutoffDate());
        return updated;
    }

    // 먼저 저장된 설정(이후 변경 포함)이 있으면 기본값으로 덮어쓰지 않는다
    private GlobalSettings createDefaults(String providerId) {
        CalendarProperties.Defaults defaults = calendarProperties.defaults();
        log.info("Creating default calendar settings: providerId={}, horizonDays={}, minNoticeHours={}",
                providerId, defaults.horizonDays(), defaults.minNoticeHours());
        return calendarRepository.createSettingsIfAbsent(
                providerId, defaults.horizonDays(), defaults.minNoticeHours(), null);
    }
}
