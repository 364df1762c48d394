package com.phillippitts.draftsmith.util;

import java.time.Clock;
import java.time.Instant;

/**
 * Time helpers shared by the provider hub and the session orchestrator.
 *
 * <p>Durations are measured with {@link System#nanoTime()} and reported in whole milliseconds.
 * Wall-clock timestamps come from an injectable {@link Clock} so step records can be asserted in tests.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} reading.
     *
     * <pre>
     * long start = System.nanoTime();
     * Result&lt;ProviderResponse, ProviderFault&gt; r = hub.execute(request);
     * long durationMs = TimeUtils.elapsedMillis(start);
     * </pre>
     *
     * @param startNanos value previously returned by {@link System#nanoTime()}
     * @return elapsed milliseconds, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0L, nanosToMillis(System.nanoTime() - startNanos));
    }

    /**
     * Current instant according to the given clock, or the system UTC clock when {@code clock} is null.
     */
    public static Instant now(Clock clock) {
        return clock == null ? Instant.now() : clock.instant();
    }
}
