package me.internalizable.shopops.ratelimit.store;

import me.internalizable.shopops.ratelimit.Rate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the increment script against a real Redis.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisWindowCounterStoreContainerTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine")
            .withExposedPorts(6379);

    private LettuceConnectionFactory connectionFactory;
    private StringRedisTemplate redisTemplate;
    private RedisWindowCounterStore store;

    @BeforeEach
    void setUp() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();

        redisTemplate = new StringRedisTemplate(connectionFactory);
        redisTemplate.afterPropertiesSet();

        store = new RedisWindowCounterStore(redisTemplate, "ratelimit", Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        connectionFactory.destroy();
    }

    private long ttlMillis(String key) {
        Long ttl = redisTemplate.getExpire("ratelimit:" + key, TimeUnit.MILLISECONDS);
        return ttl != null ? ttl : -2L;
    }

    @Test
    void countsUpAndSetsExpiryOnFirstHit() {
        Rate rate = Rate.perMinute(100);

        for (int i = 1; i <= 5; i++) {
            assertEquals(i, store.incrementAndGet("user:count", rate).count());
        }

        long ttl = ttlMillis("user:count");
        assertTrue(ttl > 55_000 && ttl <= 60_000, "ttl was " + ttl);
    }

    @Test
    void laterHitsKeepTheOriginalExpiry() throws InterruptedException {
        Rate rate = Rate.perMinute(100);
        store.incrementAndGet("user:fixed", rate);

        Thread.sleep(400);
        store.incrementAndGet("user:fixed", rate);
        store.incrementAndGet("user:fixed", rate);

        long ttl = ttlMillis("user:fixed");
        assertTrue(ttl <= 59_600, "expiry must not be pushed back, ttl was " + ttl);
    }

    @Test
    void startsNewWindowAfterTtl() throws InterruptedException {
        Rate rate = new Rate(2, Duration.ofMillis(300));
        store.incrementAndGet("user:roll", rate);
        store.incrementAndGet("user:roll", rate);
        assertEquals(3, store.incrementAndGet("user:roll", rate).count());

        Thread.sleep(600);

        WindowCounter counter = store.incrementAndGet("user:roll", rate);
        assertEquals(1, counter.count());
        assertTrue(ttlMillis("user:roll") > 0);
    }

    @Test
    void repairsKeyWithoutTtl() {
        redisTemplate.opsForValue().set("ratelimit:user:stale", "4");
        assertEquals(-1L, ttlMillis("user:stale"));

        WindowCounter counter = store.incrementAndGet("user:stale", Rate.perHour(10));

        assertEquals(5, counter.count());
        long ttl = ttlMillis("user:stale");
        assertTrue(ttl > 0 && ttl <= 3_600_000, "ttl was " + ttl);
    }

    @Test
    void peekAndResetUseTheSameKey() {
        Rate rate = Rate.perHour(10);
        store.incrementAndGet("device:abc:restore", rate);
        store.incrementAndGet("device:abc:restore", rate);

        assertEquals(2, store.peek("device:abc:restore").orElseThrow().count());

        store.reset("device:abc:restore");

        assertTrue(store.peek("device:abc:restore").isEmpty());
        assertEquals(1, store.incrementAndGet("device:abc:restore", rate).count());
    }
}
