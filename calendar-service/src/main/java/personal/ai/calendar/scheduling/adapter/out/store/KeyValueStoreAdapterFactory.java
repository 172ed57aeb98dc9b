package personal.ai.calendar.scheduling.adapter.out.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.ai.calendar.scheduling.adapter.out.redis.RedisKeyGenerator;
import personal.ai.calendar.scheduling.adapter.out.redis.RedisKeyValueStore;
import personal.ai.calendar.scheduling.application.config.CalendarProperties;

/**
 * Key-Value Store Adapter Factory
 * 설정에 따라 KeyValueStore 구현체를 생성
 *
 * 설정:
 * - calendar.store.type=redis → RedisKeyValueStore (기본값, 운영)
 * - calendar.store.type=memory → InMemoryKeyValueStore (로컬 개발 / 테스트)
 */
@Slf4j
@Configuration
public class KeyValueStoreAdapterFactory {

    /**
     * RedisKeyValueStore 빈 생성
     * calendar.store.type=redis 또는 설정이 없는 경우 (기본값)
     */
    @Bean
    @ConditionalOnProperty(name = "calendar.store.type", havingValue = "redis", matchIfMissing = true)
    public KeyValueStore redisKeyValueStore(
            StringRedisTemplate redisTemplate,
            CalendarProperties properties,
            RedisScript<Long> putItemScript,
            RedisScript<Long> putItemIfAbsentScript,
            RedisScript<Long> deleteItemScript) {

        log.info("Creating RedisKeyValueStore - keyPrefix: {}", properties.store().keyPrefix());
        return new RedisKeyValueStore(
                redisTemplate,
                new RedisKeyGenerator(properties.store().keyPrefix()),
                putItemScript,
                putItemIfAbsentScript,
                deleteItemScript);
    }

    /**
     * InMemoryKeyValueStore 빈 생성
     * calendar.store.type=memory 인 경우 (프로세스 종료 시 데이터 소멸)
     */
    @Bean
    @ConditionalOnProperty(name = "calendar.store.type", havingValue = "memory")
    public InMemoryKeyValueStore inMemoryKeyValueStore() {
        log.info("Creating InMemoryKeyValueStore - data is not persisted");
        return new InMemoryKeyValueStore();
    }
}
