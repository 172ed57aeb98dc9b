package personal.ai.calendar.scheduling.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.ai.calendar.scheduling.adapter.out.store.ConditionFailedException;
import personal.ai.calendar.scheduling.adapter.out.store.KeyValueStore;
import personal.ai.calendar.scheduling.adapter.out.store.KeyValueStoreException;
import personal.ai.calendar.scheduling.adapter.out.store.PutCondition;
import personal.ai.calendar.scheduling.adapter.out.store.SortKeyRange;
import personal.ai.calendar.scheduling.adapter.out.store.StoreItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis Key-Value Store
 * 행은 Hash, 파티션별 정렬 키 인덱스는 Sorted Set(score 0, ZRANGEBYLEX)으로 저장
 *
 * 쓰기/삭제는 Lua Script로 행과 인덱스를 함께 갱신한다.
 * 조건부 삽입은 EXISTS 검사와 HSET을 하나의 스크립트에서 수행하여 원자적이다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private static final long APPLIED = 1L;

    private final StringRedisTemplate redisTemplate;
    private final RedisKeyGenerator keyGenerator;
    private final RedisScript<Long> putItemScript;
    private final RedisScript<Long> putItemIfAbsentScript;
    private final RedisScript<Long> deleteItemScript;

    @Override
    public Optional<StoreItem> get(String partitionKey, String sortKey) {
        try {
            return readItem(partitionKey, sortKey);
        } catch (DataAccessException e) {
            throw new KeyValueStoreException(
                    String.format("Failed to read item: partitionKey=%s, sortKey=%s", partitionKey, sortKey), e);
        }
    }

    @Override
    public void put(StoreItem item, PutCondition condition) {
        RedisScript<Long> script = condition == PutCondition.INSERT_IF_ABSENT ? putItemIfAbsentScript : putItemScript;
        Long result;
        try {
            result = redisTemplate.execute(
                    script,
                    List.of(keyGenerator.itemKey(item.partitionKey(), item.sortKey()),
                            keyGenerator.indexKey(item.partitionKey())),
                    scriptArgs(item));
        } catch (DataAccessException e) {
            throw new KeyValueStoreException(
                    String.format("Failed to write item: partitionKey=%s, sortKey=%s",
                            item.partitionKey(), item.sortKey()), e);
        }

        if (result == null || result != APPLIED) {
            log.debug("Conditional put rejected: partitionKey={}, sortKey={}", item.partitionKey(), item.sortKey());
            throw new ConditionFailedException(item.partitionKey(), item.sortKey());
        }
    }

    @Override
    public void delete(String partitionKey, String sortKey) {
        try {
            redisTemplate.execute(
                    deleteItemScript,
                    List.of(keyGenerator.itemKey(partitionKey, sortKey), keyGenerator.indexKey(partitionKey)),
                    sortKey);
        } catch (DataAccessException e) {
            throw new KeyValueStoreException(
                    String.format("Failed to delete item: partitionKey=%s, sortKey=%s", partitionKey, sortKey), e);
        }
    }

    @Override
    public List<StoreItem> query(String partitionKey, SortKeyRange range) {
        if (range.lower().compareTo(range.upper()) > 0) {
            return List.of();
        }
        Range<String> lexRange = Range.of(
                Range.Bound.inclusive(range.lower()),
                range.upperInclusive() ? Range.Bound.inclusive(range.upper()) : Range.Bound.exclusive(range.upper()));

        try {
            Set<String> sortKeys = redisTemplate.opsForZSet().rangeByLex(keyGenerator.indexKey(partitionKey), lexRange);
            if (sortKeys == null || sortKeys.isEmpty()) {
                return List.of();
            }

            List<StoreItem> items = new ArrayList<>(sortKeys.size());
            for (String sortKey : sortKeys) {
                // 인덱스 조회와 행 조회 사이에 삭제된 행은 건너뛴다
                readItem(partitionKey, sortKey).ifPresent(items::add);
            }
            return items;

        } catch (DataAccessException e) {
            throw new KeyValueStoreException(
                    String.format("Failed to query items: partitionKey=%s, range=%s", partitionKey, range), e);
        }
    }

    private Optional<StoreItem> readItem(String partitionKey, String sortKey) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(keyGenerator.itemKey(partitionKey, sortKey));
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        entries.forEach((field, value) -> attributes.put(String.valueOf(field), String.valueOf(value)));
        return Optional.of(new StoreItem(partitionKey, sortKey, attributes));
    }

    // ARGV[1] = sortKey, ARGV[2..] = field, value, field, value ...
    private Object[] scriptArgs(StoreItem item) {
        List<String> args = new ArrayList<>(1 + item.attributes().size() * 2);
        args.add(item.sortKey());
        item.attributes().forEach((field, value) -> {
            args.add(field);
            args.add(value);
        });
        return args.toArray();
    }
}
