package me.internalizable.shopops.ratelimit.store;

import me.internalizable.shopops.ratelimit.Rate;

import java.time.Instant;

/**
 * Counter state for one key within a fixed window.
 *
 * @param count events observed in the current window (never decremented)
 * @param expiresAt instant at which the window resets
 */
public record WindowCounter(long count, Instant expiresAt) {

    public WindowCounter {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt cannot be null");
        }
    }

    /**
     * A fresh window opened at {@code now}.
     */
    public static WindowCounter open(Instant now, Rate rate) {
        return new WindowCounter(1, now.plus(rate.period()));
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * The entry after observing one more event at {@code now}. An absent or expired
     * entry is replaced by a new window; otherwise the count grows and the expiry stays.
     */
    public static WindowCounter next(WindowCounter current, Instant now, Rate rate) {
        if (current == null || current.isExpired(now)) {
            return open(now, rate);
        }
        return new WindowCounter(current.count + 1, current.expiresAt);
    }
}
