package com.project.recall.backend.algorithm;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class SchedulingAlgoUtils {

    /** Easiness never drops below this (SM-2 floor). */
    public static final double MIN_EASINESS = 1.3;

    private SchedulingAlgoUtils() {
    }

    /**
     * Clamps an interval into {@code [1, maxIntervalDays]}.
     *
     * A misconfigured maximum below 1 is treated as 1, so the result is always a valid
     * interval.
     */
    public static int clampInterval(int intervalDays, int maxIntervalDays) {
        int max = Math.max(1, maxIntervalDays);
        return Math.min(max, Math.max(1, intervalDays));
    }

    /**
     * Rounds the easiness to two decimals and applies the {@link #MIN_EASINESS} floor.
     */
    public static double clampEasiness(double easiness) {
        double rounded = Math.round(easiness * 100.0) / 100.0;
        return Math.max(MIN_EASINESS, rounded);
    }

    public static Instant plusDays(Instant from, int days) {
        return from.plus(days, ChronoUnit.DAYS);
    }
}
