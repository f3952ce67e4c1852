package com.project.recall.backend.algorithm;

import java.time.Instant;
import java.util.List;

/**
 * Fixed-cadence policy used by the daily and weekly reminder modes.
 *
 * The grade is ignored for scheduling; repetition still counts up so the history shows
 * how many times the card was seen.
 */
public class FixedIntervalPolicy implements IntervalPolicy {

    private final int intervalDays;

    public FixedIntervalPolicy(int intervalDays, int maxIntervalDays) {
        this.intervalDays = SchedulingAlgoUtils.clampInterval(intervalDays, maxIntervalDays);
    }

    @Override
    public ReviewComputation apply(SchedulingState state, Grade grade, Instant now) {
        int repetition = Math.max(0, state.repetition()) + 1;
        return new ReviewComputation(grade, repetition, intervalDays, state.easiness(), now,
                SchedulingAlgoUtils.plusDays(now, intervalDays));
    }

    @Override
    public List<Grade> grades() {
        return List.of(Grade.AGAIN, Grade.OK);
    }
}
