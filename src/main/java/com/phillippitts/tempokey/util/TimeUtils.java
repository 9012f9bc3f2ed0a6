package com.phillippitts.tempokey.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions and elapsed time calculations.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Age of a timestamp relative to {@code now}; never negative, so clock skew between writers
     * cannot make a record look younger than brand new.
     */
    public static Duration age(Instant then, Instant now) {
        Duration d = Duration.between(then, now);
        return d.isNegative() ? Duration.ZERO : d;
    }
}
