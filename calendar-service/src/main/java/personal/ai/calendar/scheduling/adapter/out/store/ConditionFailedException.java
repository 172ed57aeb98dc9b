package personal.ai.calendar.scheduling.adapter.out.store;

/**
 * 조건부 쓰기(INSERT_IF_ABSENT)가 기존 행 때문에 거부된 경우
 */
public class ConditionFailedException extends RuntimeException {

    public ConditionFailedException(String partitionKey, String sortKey) {
        super(String.format("Item already exists: partitionKey=%s, sortKey=%s", partitionKey, sortKey));
    }
}
