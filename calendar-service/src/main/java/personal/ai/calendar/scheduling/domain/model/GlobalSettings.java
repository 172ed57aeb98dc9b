package personal.ai.calendar.scheduling.domain.model;

import personal.ai.calendar.scheduling.domain.exception.InvalidCalendarSettingsException;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Global Settings Domain Model
 * 제공자(provider)당 하나인 예약 정책 (불변)
 *
 * @param horizonDays    예약 가능 기간 (일, 1 이상)
 * @param minNoticeHours 최소 사전 예약 시간 (시간, 0 이상)
 * @param hardCutoffDate 이 날짜 이후로는 슬롯을 제공하지 않음 (선택)
 * @param createdAt      최초 생성 시각 (저장 전에는 null)
 * @param updatedAt      마지막 저장 시각 (저장 전에는 null)
 */
public record GlobalSettings(
        String providerId,
        int horizonDays,
        int minNoticeHours,
        LocalDate hardCutoffDate,
        Instant createdAt,
        Instant updatedAt) {

    public GlobalSettings {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (horizonDays < 1) {
            throw new InvalidCalendarSettingsException(
                    String.format("horizonDays must be >= 1: horizonDays=%d", horizonDays));
        }
        if (minNoticeHours < 0) {
            throw new InvalidCalendarSettingsException(
                    String.format("minNoticeHours must be >= 0: minNoticeHours=%d", minNoticeHours));
        }
    }

    /**
     * hardCutoffDate 이후 날짜인지 확인 (cutoff 당일은 포함)
     */
    public boolean isBeyondCutoff(LocalDate date) {
        return hardCutoffDate != null && date.isAfter(hardCutoffDate);
    }

    /**
     * 최소 사전 예약 시간이 적용되는지 여부
     */
    public boolean requiresNotice() {
        return minNoticeHours > 0;
    }

    /**
     * now + minNoticeHours
     * 이 시각 이하에 시작하는 슬롯은 제공하지 않는다.
     */
    public Instant noticeBoundary(Instant now) {
        return now.plus(Duration.ofHours(minNoticeHours));
    }

    /**
     * 부분 변경 적용 (null 필드는 유지)
     */
    public GlobalSettings apply(SettingsChanges changes) {
        return new GlobalSettings(
                providerId,
                changes.horizonDays() != null ? changes.horizonDays() : horizonDays,
                changes.minNoticeHours() != null ? changes.minNoticeHours() : minNoticeHours,
                changes.hardCutoffDate() != null ? changes.hardCutoffDate() : hardCutoffDate,
                createdAt,
                updatedAt);
    }
}
