package personal.ai.calendar.scheduling.adapter.out.store;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-Memory Key-Value Store
 * 로컬 개발 / 테스트용 구현체 (calendar.store.type=memory)
 * putIfAbsent로 조건부 삽입의 원자성을 보장한다.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, ConcurrentSkipListMap<String, StoreItem>> partitions = new ConcurrentHashMap<>();

    @Override
    public Optional<StoreItem> get(String partitionKey, String sortKey) {
        NavigableMap<String, StoreItem> partition = partitions.get(partitionKey);
        return partition == null ? Optional.empty() : Optional.ofNullable(partition.get(sortKey));
    }

    @Override
    public void put(StoreItem item, PutCondition condition) {
        ConcurrentSkipListMap<String, StoreItem> partition =
                partitions.computeIfAbsent(item.partitionKey(), key -> new ConcurrentSkipListMap<>());

        if (condition == PutCondition.INSERT_IF_ABSENT) {
            if (partition.putIfAbsent(item.sortKey(), item) != null) {
                throw new ConditionFailedException(item.partitionKey(), item.sortKey());
            }
            return;
        }
        partition.put(item.sortKey(), item);
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        NavigableMap<String, StoreItem> partition = partitions.get(partitionKey);
        if (partition != null) {
            partition.remove(sortKey);
        }
    }

    @Override
    public List<StoreItem> query(String partitionKey, SortKeyRange range) {
        NavigableMap<String, StoreItem> partition = partitions.get(partitionKey);
        if (partition == null || range.lower().compareTo(range.upper()) > 0) {
            return List.of();
        }
        return List.copyOf(partition.subMap(range.lower(), true, range.upper(), range.upperInclusive()).values());
    }

    /**
     * 전체 데이터 삭제 (테스트 격리용)
     */
    public void clear() {
        partitions.clear();
    }
}
