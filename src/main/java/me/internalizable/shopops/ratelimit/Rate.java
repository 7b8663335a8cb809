package me.internalizable.shopops.ratelimit;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable rate configuration: at most {@code limit} events per {@code period}.
 *
 * Rates are usually written in configuration using the compact notation
 * {@code <limit>-<unit>}, where unit is S, M, H or D (for example {@code 100-M}).
 */
public record Rate(long limit, Duration period) {

    private static final Pattern FORMATTED = Pattern.compile("^\\s*(\\d+)\\s*-\\s*([SMHDsmhd])\\s*$");

    public Rate {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got " + limit);
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be a positive duration, got " + period);
        }
    }

    public static Rate perMinute(long limit) {
        return new Rate(limit, Duration.ofMinutes(1));
    }

    public static Rate perHour(long limit) {
        return new Rate(limit, Duration.ofHours(1));
    }

    /**
     * Parse a formatted rate such as {@code 10-H}.
     * @throws IllegalArgumentException if the text is not a valid formatted rate
     */
    public static Rate parse(String formatted) {
        if (formatted == null) {
            throw new IllegalArgumentException("Rate must not be null");
        }
        Matcher matcher = FORMATTED.matcher(formatted);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid rate '" + formatted + "', expected <limit>-<S|M|H|D>");
        }

        long limit;
        try {
            limit = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid rate limit in '" + formatted + "'", e);
        }

        Duration period = switch (matcher.group(2).toUpperCase(Locale.ROOT)) {
            case "S" -> Duration.ofSeconds(1);
            case "M" -> Duration.ofMinutes(1);
            case "H" -> Duration.ofHours(1);
            default -> Duration.ofDays(1);
        };

        if (limit <= 0) {
            throw new IllegalArgumentException("Invalid rate '" + formatted + "', limit must be > 0");
        }
        return new Rate(limit, period);
    }

    /**
     * Human readable form, e.g. "100 per minute".
     */
    public String describe() {
        return limit + " per " + describePeriod();
    }

    public String describePeriod() {
        if (period.equals(Duration.ofSeconds(1))) return "second";
        if (period.equals(Duration.ofMinutes(1))) return "minute";
        if (period.equals(Duration.ofHours(1))) return "hour";
        if (period.equals(Duration.ofDays(1))) return "day";
        return period.toSeconds() + " seconds";
    }
}
