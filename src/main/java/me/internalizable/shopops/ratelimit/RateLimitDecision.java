package me.internalizable.shopops.ratelimit;

import java.time.Instant;

/**
 * Outcome of one rate limit check, derived from the counter read at request time.
 *
 * @param limit configured maximum events per window
 * @param remaining events left in the current window, never negative
 * @param reached true once the count exceeds the limit
 * @param resetAfterSeconds whole seconds until the window resets
 * @param resetAt instant at which the window resets
 * @param failOpen true when the counter store failed and the request is admitted uncounted
 */
public record RateLimitDecision(
        long limit,
        long remaining,
        boolean reached,
        long resetAfterSeconds,
        Instant resetAt,
        boolean failOpen
) {

    public static RateLimitDecision counted(long limit, long count, Instant expiresAt, Instant now) {
        long remaining = Math.max(0L, limit - count);
        long millisLeft = Math.max(0L, expiresAt.toEpochMilli() - now.toEpochMilli());
        long resetAfterSeconds = (millisLeft + 999L) / 1000L;
        return new RateLimitDecision(limit, remaining, count > limit, resetAfterSeconds, expiresAt, false);
    }

    /**
     * Admit signal used when counting was not possible.
     */
    public static RateLimitDecision failOpen(long limit, Instant now) {
        return new RateLimitDecision(limit, limit, false, 0L, now, true);
    }

    public boolean admitted() {
        return !reached;
    }
}
