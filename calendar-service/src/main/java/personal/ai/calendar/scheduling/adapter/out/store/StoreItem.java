package personal.ai.calendar.scheduling.adapter.out.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key-Value 저장소의 단일 행
 *
 * @param partitionKey 파티션 키 (제공자 단위)
 * @param sortKey      파티션 내 정렬 키 (사전순 정렬)
 * @param attributes   문자열 속성 (비어 있을 수 없음)
 */
public record StoreItem(String partitionKey, String sortKey, Map<String, String> attributes) {

    public StoreItem {
        if (partitionKey == null || partitionKey.isBlank()) {
            throw new IllegalArgumentException("Partition key cannot be null or blank");
        }
        if (sortKey == null || sortKey.isBlank()) {
            throw new IllegalArgumentException("Sort key cannot be null or blank");
        }
        if (attributes == null || attributes.isEmpty()) {
            throw new IllegalArgumentException("Item attributes cannot be empty: sortKey=" + sortKey);
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
