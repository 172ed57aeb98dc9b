package personal.ai.calendar.scheduling.adapter.out.redis;

/**
 * Redis Key 생성기
 *
 * Redis Cluster 호환:
 * - Hash Tag {partitionKey}를 사용하여 같은 제공자의 행과 인덱스가 같은 노드에 저장됨
 * - 행 + 인덱스를 함께 갱신하는 Lua Script Multi-Key 연산이 가능해짐
 *
 * Convention:
 * - 행(Hash): {keyPrefix}:item:{partitionKey}:sortKey
 * - 인덱스(Sorted Set, score 0 + 사전순): {keyPrefix}:index:{partitionKey}
 */
public class RedisKeyGenerator {

    private static final String ITEM_KEY_FORMAT = "%s:item:{%s}:%s";
    private static final String INDEX_KEY_FORMAT = "%s:index:{%s}";

    private final String keyPrefix;

    public RedisKeyGenerator(String keyPrefix) {
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("Key prefix cannot be null or blank");
        }
        this.keyPrefix = keyPrefix;
    }

    public String itemKey(String partitionKey, String sortKey) {
        return String.format(ITEM_KEY_FORMAT, keyPrefix, partitionKey, sortKey);
    }

    public String indexKey(String partitionKey) {
        return String.format(INDEX_KEY_FORMAT, keyPrefix, partitionKey);
    }
}
