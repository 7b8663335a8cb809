package me.internalizable.shopops.ratelimit.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Builder;
import lombok.Getter;
import me.internalizable.shopops.ratelimit.Rate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local counter store backed by Caffeine.
 *
 * Each key is mutated through {@code asMap().compute}, which serializes writers of the
 * same key without blocking other keys. Every entry expires at its own window end, so
 * expired counters are swept instead of accumulating for the process lifetime.
 */
@Getter
public class InMemoryWindowCounterStore implements WindowCounterStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWindowCounterStore.class);

    private final Cache<String, WindowCounter> counters;
    private final String name;
    private final long maxSize;
    private final Clock clock;

    @Builder
    public InMemoryWindowCounterStore(String name, long maxSize, Clock clock) {
        this.name = name != null ? name : "local";
        this.maxSize = maxSize > 0 ? maxSize : 100_000;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.counters = Caffeine.newBuilder()
                .maximumSize(this.maxSize)
                .expireAfter(new WindowExpiry())
                .ticker(clockTicker(this.clock))
                .scheduler(Scheduler.systemScheduler())
                .recordStats()
                .build();

        logger.info("[{}] In-memory counter store initialized - max size: {}", this.name, this.maxSize);
    }

    @Override
    public WindowCounter incrementAndGet(String key, Rate rate) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (rate == null) {
            throw new IllegalArgumentException("rate cannot be null");
        }
        return counters.asMap().compute(key, (k, current) -> WindowCounter.next(current, clock.instant(), rate));
    }

    @Override
    public Optional<WindowCounter> peek(String key) {
        WindowCounter counter = counters.getIfPresent(key);
        if (counter == null || counter.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(counter);
    }

    @Override
    public void reset(String key) {
        counters.invalidate(key);
        logger.trace("[{}] Reset key: {}", name, key);
    }

    @Override
    public Map<String, Object> getStats() {
        var stats = counters.stats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("type", "local");
        result.put("size", counters.estimatedSize());
        result.put("max_size", maxSize);
        result.put("evictions", stats.evictionCount());
        return result;
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> toNanos(clock.instant());
    }

    private static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    /**
     * Expires each counter exactly at the end of its window.
     */
    private static final class WindowExpiry implements Expiry<String, WindowCounter> {

        @Override
        public long expireAfterCreate(String key, WindowCounter value, long currentTime) {
            return untilWindowEnd(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, WindowCounter value, long currentTime, long currentDuration) {
            return untilWindowEnd(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, WindowCounter value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long untilWindowEnd(WindowCounter value, long currentTime) {
            return Math.max(0L, toNanos(value.expiresAt()) - currentTime);
        }
    }
}
