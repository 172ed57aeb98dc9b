package personal.ai.calendar.scheduling.adapter.out.persistence;

import personal.ai.calendar.scheduling.domain.model.SlotTimes;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 캘린더 키 레이아웃
 *
 * Partition Key: PROVIDER#{providerId}
 * Sort Key:
 * - 설정:      SETTINGS#GLOBAL
 * - 반복 규칙: RULE#DOM#{dd}            (예: RULE#DOM#05)
 * - 예외 설정: DATE#{yyyy-MM-dd}
 * - 예약:      BOOKING#{yyyy-MM-dd}#T{HHmm} (예: BOOKING#2024-01-15#T0930)
 *
 * 0 채움 숫자로 사전순 정렬이 날짜/시간 순서와 일치한다.
 */
public final class CalendarKeys {

    public static final String SETTINGS_SORT_KEY = "SETTINGS#GLOBAL";
    public static final String RULE_PREFIX = "RULE#DOM#";
    public static final String OVERRIDE_PREFIX = "DATE#";
    public static final String BOOKING_PREFIX = "BOOKING#";

    private static final String PARTITION_PREFIX = "PROVIDER#";

    private CalendarKeys() {
    }

    public static String partitionKey(String providerId) {
        return PARTITION_PREFIX + providerId;
    }

    public static String ruleKey(int dayOfMonth) {
        return String.format("%s%02d", RULE_PREFIX, dayOfMonth);
    }

    public static String overrideKey(LocalDate date) {
        return OVERRIDE_PREFIX + date;
    }

    public static String bookingKey(LocalDate date, LocalTime time) {
        return bookingDatePrefix(date) + "T" + SlotTimes.toKey(time);
    }

    /**
     * 하루의 모든 예약 키가 공유하는 prefix (BOOKING#{date}#)
     */
    public static String bookingDatePrefix(LocalDate date) {
        return BOOKING_PREFIX + date + "#";
    }
}
