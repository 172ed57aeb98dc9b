package personal.ai.calendar.scheduling.application.port.out;

/**
 * 예약 쓰기 조건
 */
public enum WriteCondition {
    /**
     * 같은 키의 행이 없을 때만 삽입 (원자적 조건부 삽입, 동시성 보호의 유일한 수단)
     */
    MUST_NOT_EXIST,

    /**
     * 무조건 덮어쓰기
     */
    NONE
}
