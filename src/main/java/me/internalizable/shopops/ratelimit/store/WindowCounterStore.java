package me.internalizable.shopops.ratelimit.store;

import me.internalizable.shopops.ratelimit.Rate;

import java.util.Map;
import java.util.Optional;

/**
 * Fixed-window counter storage shared by the endpoint limiters.
 * Allows switching between local (Caffeine) and Redis backed counters.
 */
public interface WindowCounterStore {

    /**
     * Count one event for a key and read the resulting window back atomically.
     * An absent or expired entry starts a new window of {@code rate.period()} with count 1.
     *
     * @param key opaque counter key, must not be blank
     * @param rate rate whose period sizes new windows; the limit is not interpreted here
     * @return the post-increment counter
     * @throws StoreUnavailableException if the backing store failed
     */
    WindowCounter incrementAndGet(String key, Rate rate);

    /**
     * Read a live counter without counting an event.
     * @param key The counter key
     * @return the counter, or empty when absent or expired
     */
    Optional<WindowCounter> peek(String key);

    /**
     * Drop the counter for a key (admin override)
     * @param key The counter key
     */
    void reset(String key);

    Map<String, Object> getStats();
}
