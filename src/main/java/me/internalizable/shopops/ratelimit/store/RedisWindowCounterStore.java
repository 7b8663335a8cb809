package me.internalizable.shopops.ratelimit.store;

import me.internalizable.shopops.ratelimit.Rate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedRuntimeException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis backed counter store using a Lua script so the increment, the expiry and the
 * read-back happen as one atomic operation. Window rollover is delegated to the key TTL.
 *
 * Connection, pool and command failures are surfaced as {@link StoreUnavailableException};
 * deciding to fail open is the limiter's job, not the store's.
 */
public class RedisWindowCounterStore implements WindowCounterStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisWindowCounterStore.class);

    // returns {count, remaining ttl in ms}
    private static final String INCREMENT_LUA = """
            local key = KEYS[1]
            local period = tonumber(ARGV[1])

            local current = redis.call('INCR', key)
            local ttl = redis.call('PTTL', key)

            if current == 1 or ttl < 0 then
                redis.call('PEXPIRE', key, period)
                ttl = period
            end

            return {current, ttl}
            """;

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<List<Long>> incrementScript;
    private final String keyPrefix;
    private final Clock clock;

    public RedisWindowCounterStore(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock) {
        if (redisTemplate == null) {
            throw new IllegalArgumentException("redisTemplate cannot be null");
        }
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix != null ? (keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":") : "ratelimit:";
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.incrementScript = RedisScript.of(INCREMENT_LUA, longListType());

        logger.info("Redis counter store initialized - prefix: {}", this.keyPrefix);
    }

    @Override
    public WindowCounter incrementAndGet(String key, Rate rate) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (rate == null) {
            throw new IllegalArgumentException("rate cannot be null");
        }

        List<Long> result;
        try {
            result = redisTemplate.execute(
                    incrementScript,
                    List.of(keyPrefix + key),
                    String.valueOf(rate.period().toMillis())
            );
        } catch (NestedRuntimeException e) {
            throw new StoreUnavailableException(key, e);
        }

        if (result == null || result.size() < 2) {
            throw new StoreUnavailableException(key,
                    new IllegalStateException("Unexpected script result: " + result));
        }

        long count = toLong(result.get(0));
        long ttlMillis = toLong(result.get(1));
        Instant now = clock.instant();
        return new WindowCounter(count, now.plusMillis(Math.max(0L, ttlMillis)));
    }

    @Override
    public Optional<WindowCounter> peek(String key) {
        try {
            String redisKey = keyPrefix + key;
            String value = redisTemplate.opsForValue().get(redisKey);
            if (value == null) {
                return Optional.empty();
            }
            Long ttl = redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS);
            long ttlMillis = ttl != null && ttl > 0 ? ttl : 0L;
            return Optional.of(new WindowCounter(Long.parseLong(value), clock.instant().plusMillis(ttlMillis)));
        } catch (NestedRuntimeException e) {
            throw new StoreUnavailableException(key, e);
        }
    }

    @Override
    public void reset(String key) {
        try {
            redisTemplate.delete(keyPrefix + key);
        } catch (NestedRuntimeException e) {
            throw new StoreUnavailableException(key, e);
        }
    }

    @Override
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("type", "redis");
        stats.put("prefix", keyPrefix);
        try {
            Set<String> keys = redisTemplate.keys(keyPrefix + "*");
            stats.put("size", keys != null ? keys.size() : 0);
        } catch (NestedRuntimeException e) {
            logger.warn("[Redis] Unable to count keys with prefix {}: {}", keyPrefix, e.getMessage());
            stats.put("size", "unavailable");
        }
        return stats;
    }

    @SuppressWarnings("unchecked")
    private static Class<List<Long>> longListType() {
        return (Class<List<Long>>) (Class<?>) List.class;
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
