package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.DateOverride;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Manage Date Overrides UseCase (Input Port)
 * 특정 날짜의 차단(BLOCKED) / 슬롯 대체(MODIFIED) 관리
 */
public interface ManageDateOverridesUseCase {

    /**
     * 예외 설정 생성 또는 교체
     */
    DateOverride putOverride(PutDateOverrideCommand command);

    /**
     * 예외 설정 부분 변경
     *
     * @throws personal.ai.calendar.scheduling.domain.exception.DateOverrideNotFoundException 예외 설정이 없을 때
     */
    DateOverride updateOverride(UpdateDateOverrideCommand command);

    Optional<DateOverride> getOverride(String providerId, LocalDate date);

    List<DateOverride> listOverrides(String providerId, LocalDate startDate, LocalDate endDate);

    void deleteOverride(String providerId, LocalDate date);
}
