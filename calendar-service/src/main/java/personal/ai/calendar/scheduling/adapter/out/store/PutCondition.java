package personal.ai.calendar.scheduling.adapter.out.store;

/**
 * 쓰기 조건
 */
public enum PutCondition {
    /**
     * 무조건 덮어쓰기
     */
    NONE,

    /**
     * 같은 (partitionKey, sortKey) 행이 없을 때만 삽입 (원자적)
     */
    INSERT_IF_ABSENT
}
