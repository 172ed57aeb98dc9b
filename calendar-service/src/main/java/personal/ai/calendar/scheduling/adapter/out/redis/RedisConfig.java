package personal.ai.calendar.scheduling.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis Configuration
 * 행(Hash) + 인덱스(Sorted Set)를 원자적으로 갱신하는 Lua Script 빈
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisScript<Long> putItemScript() {
        return RedisScript.of(new ClassPathResource("scripts/put_item.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> putItemIfAbsentScript() {
        return RedisScript.of(new ClassPathResource("scripts/put_item_if_absent.lua"), Long.class);
    }

    @Bean
    public RedisScript<Long> deleteItemScript() {
        return RedisScript.of(new ClassPathResource("scripts/delete_item.lua"), Long.class);
    }
}
