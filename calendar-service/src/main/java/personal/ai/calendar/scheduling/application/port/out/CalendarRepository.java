package personal.ai.calendar.scheduling.application.port.out;

import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.DateOverride;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;
import personal.ai.calendar.scheduling.domain.model.OverrideType;
import personal.ai.calendar.scheduling.domain.model.RecurringRule;
import personal.ai.calendar.scheduling.domain.model.SettingsChanges;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Calendar Repository (Output Port)
 * 설정/규칙/예외 설정/예약을 제공자 단위 partition + sort key 저장소에 읽고 쓰는 인터페이스
 *
 * 모든 쓰기는 updatedAt을 갱신하고, createdAt은 최초 생성 시 한 번만 설정한다.
 * 모든 호출은 저장소에 대한 블로킹 호출이며 저장소 장애는 그대로 전파된다.
 */
public interface CalendarRepository {

    // ========== Settings ==========

    Optional<GlobalSettings> getSettings(String providerId);

    GlobalSettings putSettings(String providerId, int horizonDays, int minNoticeHours, LocalDate hardCutoffDate);

    /**
     * 설정이 없을 때만 원자적으로 생성
     *
     * @return 새로 생성된 설정, 이미 있으면 저장소에 있는 설정
     */
    GlobalSettings createSettingsIfAbsent(String providerId, int horizonDays, int minNoticeHours, LocalDate hardCutoffDate);

    /**
     * 설정 부분 변경 (read-modify-write)
     *
     * @return 변경된 설정, 설정이 없으면 empty
     */
    Optional<GlobalSettings> updateSettings(String providerId, SettingsChanges changes);

    // ========== Recurring Rules ==========

    RecurringRule putRule(String providerId, int dayOfMonth, List<LocalTime> availableSlots);

    Optional<RecurringRule> getRule(String providerId, int dayOfMonth);

    /**
     * @return dayOfMonth 오름차순
     */
    List<RecurringRule> listRules(String providerId);

    void deleteRule(String providerId, int dayOfMonth);

    // ========== Date Overrides ==========

    DateOverride putOverride(String providerId, LocalDate date, OverrideType type, List<LocalTime> overrideSlots);

    Optional<DateOverride> getOverride(String providerId, LocalDate date);

    /**
     * @return [startDate, endDate] 양 끝 포함, 날짜 오름차순
     */
    List<DateOverride> listOverrides(String providerId, LocalDate startDate, LocalDate endDate);

    void deleteOverride(String providerId, LocalDate date);

    // ========== Bookings ==========

    /**
     * 예약 저장
     *
     * @param booking   저장할 예약 (createdAt이 있으면 유지)
     * @param condition MUST_NOT_EXIST: 원자적 조건부 삽입
     * @return 저장된 예약 (타임스탬프 포함)
     * @throws personal.ai.calendar.scheduling.domain.exception.SlotAlreadyBookedException
     *         MUST_NOT_EXIST 조건에서 같은 키의 행이 이미 존재할 때
     */
    Booking putBooking(Booking booking, WriteCondition condition);

    Optional<Booking> getBooking(String providerId, LocalDate date, LocalTime time);

    void deleteBooking(String providerId, LocalDate date, LocalTime time);

    /**
     * @return 시간 오름차순
     */
    List<Booking> listBookingsForDate(String providerId, LocalDate date);

    /**
     * @return [startDate, endDate] 양 끝 포함, 날짜 -> 시간 오름차순
     */
    List<Booking> listBookingsForRange(String providerId, LocalDate startDate, LocalDate endDate);
}
