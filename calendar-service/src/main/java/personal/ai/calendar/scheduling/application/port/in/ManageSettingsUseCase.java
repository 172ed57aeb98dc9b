package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.GlobalSettings;

/**
 * Manage Settings UseCase (Input Port)
 */
public interface ManageSettingsUseCase {

    /**
     * 설정 조회, 없으면 기본값(horizonDays=30, minNoticeHours=2)으로 생성
     */
    GlobalSettings getOrCreateSettings(String providerId);

    /**
     * 설정 부분 변경
     *
     * @throws personal.ai.calendar.scheduling.domain.exception.SettingsNotFoundException 설정이 아직 없을 때
     */
    GlobalSettings updateSettings(UpdateSettingsCommand command);
}
