package personal.ai.calendar.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.ai.calendar.scheduling.adapter.out.store.ConditionFailedException;
import personal.ai.calendar.scheduling.adapter.out.store.KeyValueStore;
import personal.ai.calendar.scheduling.adapter.out.store.PutCondition;
import personal.ai.calendar.scheduling.adapter.out.store.SortKeyRange;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.application.port.out.WriteCondition;
import personal.ai.calendar.scheduling.domain.exception.SettingsNotFoundException;
import personal.ai.calendar.scheduling.domain.exception.SlotAlreadyBookedException;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.DateOverride;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;
import personal.ai.calendar.scheduling.domain.model.OverrideType;
import personal.ai.calendar.scheduling.domain.model.RecurringRule;
import personal.ai.calendar.scheduling.domain.model.SettingsChanges;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

/**
 * Calendar Persistence Adapter
 * CalendarRepository 포트를 KeyValueStore 위에 구현
 *
 * 제공자당 하나의 파티션에 설정/규칙/예외 설정/예약을 모두 저장한다.
 * createdAt은 기존 행이 있으면 유지하고, updatedAt은 매 쓰기마다 갱신한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarPersistenceAdapter implements CalendarRepository {

    private final KeyValueStore keyValueStore;
    private final CalendarItemMapper itemMapper;
    private final Clock clock;

    // ========== Settings ==========

    @Override
    public Optional<GlobalSettings> getSettings(String providerId) {
        return keyValueStore.get(CalendarKeys.partitionKey(providerId), CalendarKeys.SETTINGS_SORT_KEY)
                .map(itemMapper::toSettings);
    }

    @Override
    public GlobalSettings putSettings(String providerId, int horizonDays, int minNoticeHours, LocalDate hardCutoffDate) {
        Instant now = clock.instant();
        Instant createdAt = getSettings(providerId).map(GlobalSettings::createdAt).orElse(now);

        GlobalSettings settings = new GlobalSettings(providerId, horizonDays, minNoticeHours, hardCutoffDate, createdAt, now);
        keyValueStore.put(itemMapper.toItem(settings), PutCondition.NONE);
        return settings;
    }

    @Override
    public GlobalSettings createSettingsIfAbsent(String providerId, int horizonDays, int minNoticeHours,
                                                 LocalDate hardCutoffDate) {
        Instant now = clock.instant();
        GlobalSettings settings = new GlobalSettings(providerId, horizonDays, minNoticeHours, hardCutoffDate, now, now);
        try {
            keyValueStore.put(itemMapper.toItem(settings), PutCondition.INSERT_IF_ABSENT);
            return settings;
        } catch (ConditionFailedException e) {
            log.debug("Settings already created by another request: providerId={}", providerId);
            return getSettings(providerId)
                    .orElseThrow(() -> new SettingsNotFoundException(providerId));
        }
    }

    @Override
    public Optional<GlobalSettings> updateSettings(String providerId, SettingsChanges changes) {
        Optional<GlobalSettings> existing = getSettings(providerId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        GlobalSettings applied = existing.get().apply(changes);
        GlobalSettings updated = new GlobalSettings(providerId, applied.horizonDays(), applied.minNoticeHours(),
                applied.hardCutoffDate(), applied.createdAt(), clock.instant());
        keyValueStore.put(itemMapper.toItem(updated), PutCondition.NONE);
        return Optional.of(updated);
    }

    // ========== Recurring Rules ==========

    @Override
    public RecurringRule putRule(String providerId, int dayOfMonth, List<LocalTime> availableSlots) {
        Instant now = clock.instant();
        Instant createdAt = getRule(providerId, dayOfMonth).map(RecurringRule::createdAt).orElse(now);

        RecurringRule rule = new RecurringRule(providerId, dayOfMonth, availableSlots, createdAt, now);
        keyValueStore.put(itemMapper.toItem(rule), PutCondition.NONE);
        return rule;
    }

    @Override
    public Optional<RecurringRule> getRule(String providerId, int dayOfMonth) {
        return keyValueStore.get(CalendarKeys.partitionKey(providerId), CalendarKeys.ruleKey(dayOfMonth))
                .map(itemMapper::toRule);
    }

    @Override
    public List<RecurringRule> listRules(String providerId) {
        return keyValueStore.query(CalendarKeys.partitionKey(providerId), SortKeyRange.prefix(CalendarKeys.RULE_PREFIX))
                .stream()
                .map(itemMapper::toRule)
                .toList();
    }

    @Override
    public void deleteRule(String providerId, int dayOfMonth) {
        keyValueStore.delete(CalendarKeys.partitionKey(providerId), CalendarKeys.ruleKey(dayOfMonth));
    }

    // ========== Date Overrides ==========

    @Override
    public DateOverride putOverride(String providerId, LocalDate date, OverrideType type, List<LocalTime> overrideSlots) {
        Instant now = clock.instant();
        Instant createdAt = getOverride(providerId, date).map(DateOverride::createdAt).orElse(now);

        DateOverride override = new DateOverride(providerId, date, type, overrideSlots, createdAt, now);
        keyValueStore.put(itemMapper.toItem(override), PutCondition.NONE);
        return override;
    }

    @Override
    public Optional<DateOverride> getOverride(String providerId, LocalDate date) {
        return keyValueStore.get(CalendarKeys.partitionKey(providerId), CalendarKeys.overrideKey(date))
                .map(itemMapper::toOverride);
    }

    @Override
    public List<DateOverride> listOverrides(String providerId, LocalDate startDate, LocalDate endDate) {
        SortKeyRange range = SortKeyRange.between(CalendarKeys.overrideKey(startDate), CalendarKeys.overrideKey(endDate));
        return keyValueStore.query(CalendarKeys.partitionKey(providerId), range)
                .stream()
                .map(itemMapper::toOverride)
                .toList();
    }

    @Override
    public void deleteOverride(String providerId, LocalDate date) {
        keyValueStore.delete(CalendarKeys.partitionKey(providerId), CalendarKeys.overrideKey(date));
    }

    // ========== Bookings ==========

    @Override
    public Booking putBooking(Booking booking, WriteCondition condition) {
        Instant now = clock.instant();
        Booking stamped = new Booking(booking.providerId(), booking.date(), booking.time(),
                booking.clientIdentifier(), booking.status(), booking.appointmentDetails(),
                booking.createdAt() != null ? booking.createdAt() : now, now);

        PutCondition putCondition = condition == WriteCondition.MUST_NOT_EXIST
                ? PutCondition.INSERT_IF_ABSENT
                : PutCondition.NONE;
        try {
            keyValueStore.put(itemMapper.toItem(stamped), putCondition);
        } catch (ConditionFailedException e) {
            log.debug("Booking key already exists: providerId={}, date={}, time={}",
                    booking.providerId(), booking.date(), booking.time());
            throw new SlotAlreadyBookedException(booking.providerId(), booking.date(), booking.time());
        }
        return stamped;
    }

    @Override
    public Optional<Booking> getBooking(String providerId, LocalDate date, LocalTime time) {
        return keyValueStore.get(CalendarKeys.partitionKey(providerId), CalendarKeys.bookingKey(date, time))
                .map(itemMapper::toBooking);
    }

    @Override
    public void deleteBooking(String providerId, LocalDate date, LocalTime time) {
        keyValueStore.delete(CalendarKeys.partitionKey(providerId), CalendarKeys.bookingKey(date, time));
    }

    @Override
    public List<Booking> listBookingsForDate(String providerId, LocalDate date) {
        return queryBookings(providerId, SortKeyRange.prefix(CalendarKeys.bookingDatePrefix(date)));
    }

    @Override
    public List<Booking> listBookingsForRange(String providerId, LocalDate startDate, LocalDate endDate) {
        SortKeyRange range = SortKeyRange.spanning(
                CalendarKeys.bookingDatePrefix(startDate), CalendarKeys.bookingDatePrefix(endDate));
        return queryBookings(providerId, range);
    }

    private List<Booking> queryBookings(String providerId, SortKeyRange range) {
        return keyValueStore.query(CalendarKeys.partitionKey(providerId), range)
                .stream()
                .map(itemMapper::toBooking)
                .toList();
    }
}
