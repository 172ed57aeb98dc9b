package personal.ai.calendar.scheduling.domain.model;

import java.time.LocalDate;

/**
 * 캘린더 설정 부분 변경 값
 * null 필드는 "변경 없음"을 의미한다.
 */
public record SettingsChanges(
        Integer horizonDays,
        Integer minNoticeHours,
        LocalDate hardCutoffDate) {
}
