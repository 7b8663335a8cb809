package me.internalizable.shopops.config;

import me.internalizable.shopops.ratelimit.store.InMemoryWindowCounterStore;
import me.internalizable.shopops.ratelimit.store.RedisWindowCounterStore;
import me.internalizable.shopops.ratelimit.store.WindowCounterStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class RateLimitConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(
            name = "rate-limit.use-redis",
            havingValue = "true",
            matchIfMissing = false
    )
    public WindowCounterStore redisWindowCounterStore(
            StringRedisTemplate redisTemplate,
            Clock clock,
            @Value("${rate-limit.key-prefix:ratelimit:}") String keyPrefix) {
        return new RedisWindowCounterStore(redisTemplate, keyPrefix, clock);
    }

    @Bean
    @ConditionalOnProperty(
            name = "rate-limit.use-redis",
            havingValue = "false",
            matchIfMissing = true
    )
    public WindowCounterStore localWindowCounterStore(
            Clock clock,
            @Value("${rate-limit.local.max-size:100000}") long maxSize) {
        return InMemoryWindowCounterStore.builder()
                .name("counters")
                .maxSize(maxSize)
                .clock(clock)
                .build();
    }
}
