package com.phillippitts.shortcutengine.util;

/**
 * Utility methods for monotonic time readings used by debounce and handler timing.
 *
 * <p>All readings derive from {@link System#nanoTime()}, so they are only meaningful as
 * differences within one JVM and never jump with wall-clock adjustments.
 *
 * @since 1.0
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
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Current monotonic reading in milliseconds.
     */
    public static long monotonicMillis() {
        return nanosToMillis(System.nanoTime());
    }

    /**
     * Calculates elapsed nanoseconds since a {@link System#nanoTime()} timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed nanoseconds since startNanos
     */
    public static long elapsedNanos(long startNanos) {
        return System.nanoTime() - startNanos;
    }
}
