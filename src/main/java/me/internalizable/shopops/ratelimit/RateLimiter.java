package me.internalizable.shopops.ratelimit;

import lombok.Getter;
import me.internalizable.shopops.ratelimit.store.WindowCounter;
import me.internalizable.shopops.ratelimit.store.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Fixed-window limiter for one endpoint class.
 *
 * Holds no mutable state: counters live in the shared {@link WindowCounterStore}, and the
 * key suffix keeps this limiter's counters apart from other classes using the same store.
 *
 * The fixed window may admit up to twice the limit across a window boundary.
 *
 * Any store failure fails open: the request is admitted uncounted and the failure is logged.
 */
@Getter
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final Rate rate;
    private final String keySuffix;
    private final WindowCounterStore store;
    private final Clock clock;

    public RateLimiter(String name, Rate rate, String keySuffix, WindowCounterStore store, Clock clock) {
        if (rate == null) {
            throw new IllegalArgumentException("rate cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.name = name;
        this.rate = rate;
        this.keySuffix = keySuffix != null ? keySuffix : "";
        this.store = store;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Count one request for the given client key and decide whether it may proceed.
     * @param baseKey identity key such as {@code user:42}; the class suffix is appended here
     */
    public RateLimitDecision check(String baseKey) {
        String key = counterKey(baseKey);

        WindowCounter counter;
        try {
            counter = store.incrementAndGet(key, rate);
        } catch (RuntimeException e) {
            logger.warn("[{}] Counter store failed for key {}, admitting request", name, key, e);
            return RateLimitDecision.failOpen(rate.limit(), clock.instant());
        }

        Instant now = clock.instant();
        RateLimitDecision decision = RateLimitDecision.counted(rate.limit(), counter.count(), counter.expiresAt(), now);
        if (decision.reached()) {
            logger.debug("[{}] Limit reached for key {} ({} > {}), resets in {}s",
                    name, key, counter.count(), rate.limit(), decision.resetAfterSeconds());
        }
        return decision;
    }

    public String counterKey(String baseKey) {
        return baseKey + keySuffix;
    }
}
