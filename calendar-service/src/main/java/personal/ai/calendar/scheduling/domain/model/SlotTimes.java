package personal.ai.calendar.scheduling.domain.model;

import personal.ai.calendar.scheduling.domain.exception.InvalidSlotTimeException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;

/**
 * 슬롯 시간 정규화 유틸리티
 *
 * 입력: "0930", "09:30", " 09:30 " (콜론 제거 후 정확히 4자리 숫자)
 * 표시 형식: HH:MM (예: 09:30)
 * 키 형식: HHMM (예: 0930, 저장소 sort key에 사용)
 */
public final class SlotTimes {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("HHmm");
    private static final int DIGIT_COUNT = 4;

    private SlotTimes() {
    }

    /**
     * 문자열 시간을 분 단위 LocalTime으로 변환
     *
     * @param rawTime HHMM 또는 HH:MM
     * @return 정규화된 시간
     * @throws InvalidSlotTimeException 4자리 숫자로 정규화되지 않거나 범위를 벗어난 경우
     */
    public static LocalTime parse(String rawTime) {
        if (rawTime == null) {
            throw new InvalidSlotTimeException(null);
        }
        String digits = rawTime.replace(":", "").strip();
        if (digits.length() != DIGIT_COUNT || !isAsciiDigits(digits)) {
            throw new InvalidSlotTimeException(rawTime);
        }
        int hour = Integer.parseInt(digits.substring(0, 2));
        int minute = Integer.parseInt(digits.substring(2));
        if (hour > 23 || minute > 59) {
            throw new InvalidSlotTimeException(rawTime);
        }
        return LocalTime.of(hour, minute);
    }

    /**
     * 여러 시간 문자열을 정규화 (중복 제거 + 오름차순)
     */
    public static List<LocalTime> parseAll(Collection<String> rawTimes) {
        if (rawTimes == null) {
            return List.of();
        }
        return rawTimes.stream()
                .map(SlotTimes::parse)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * "0930" / "09:30" -> "09:30"
     */
    public static String normalize(String rawTime) {
        return format(parse(rawTime));
    }

    public static String format(LocalTime time) {
        return time.format(DISPLAY_FORMAT);
    }

    public static String toKey(LocalTime time) {
        return time.format(KEY_FORMAT);
    }

    private static boolean isAsciiDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
