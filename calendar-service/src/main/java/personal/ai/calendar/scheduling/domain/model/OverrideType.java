package personal.ai.calendar.scheduling.domain.model;

/**
 * Date Override 유형
 */
public enum OverrideType {
    /**
     * 해당 날짜 전체 차단 (규칙/예약과 무관하게 슬롯 없음)
     */
    BLOCKED,

    /**
     * 해당 날짜의 규칙 슬롯을 overrideSlots로 완전히 대체 (병합하지 않음)
     */
    MODIFIED
}
