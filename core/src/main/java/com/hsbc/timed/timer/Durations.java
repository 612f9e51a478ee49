package com.hsbc.timed.timer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Argument checks and conversions shared by the timed controllers.
 */
public final class Durations {

    private Durations() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if {@code duration} is {@code null} or negative
     */
    public static Duration requireNotNegative(Duration duration, String name) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return duration;
    }

    /**
     * Converts a delay to nanoseconds for a {@link java.util.concurrent.ScheduledExecutorService}.
     * Delays beyond {@code Long.MAX_VALUE} nanoseconds, roughly 292 years, saturate instead of
     * overflowing.
     */
    public static long toDelayNanos(Duration duration) {
        return TimeUnit.NANOSECONDS.convert(duration);
    }
}
