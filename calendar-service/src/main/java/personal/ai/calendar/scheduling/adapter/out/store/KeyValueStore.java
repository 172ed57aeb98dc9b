package personal.ai.calendar.scheduling.adapter.out.store;

import java.util.List;
import java.util.Optional;

/**
 * Partition + Sort Key 저장소 계약
 *
 * - 단일 행 조건부 삽입은 원자적이어야 한다.
 * - 같은 파티션 내 정렬 키 범위 조회는 정렬 키 사전순으로 반환한다.
 * - 여러 행에 걸친 트랜잭션은 제공하지 않는다.
 */
public interface KeyValueStore {

    Optional<StoreItem> get(String partitionKey, String sortKey);

    /**
     * @throws ConditionFailedException INSERT_IF_ABSENT 조건에서 행이 이미 존재할 때
     * @throws KeyValueStoreException   저장소 접근 실패
     */
    void put(StoreItem item, PutCondition condition);

    /**
     * 행 삭제 (없으면 무시)
     */
    void delete(String partitionKey, String sortKey);

    /**
     * @return 범위 내 행, 정렬 키 오름차순
     */
    List<StoreItem> query(String partitionKey, SortKeyRange range);
}
