package com.project.recall.backend.algorithm;

import java.time.Instant;
import java.util.List;

/**
 * The ladder-based adaptive policy with two grades (again / ok).
 *
 * A passing grade climbs one rung of a fixed ladder of intervals, a failing grade drops
 * the card back to the bottom:
 *
 * <pre>
 *   ladder = [1, 3, 7, 14, 30]
 *
 *   repetition 0 --ok--> repetition 1, interval 1
 *   repetition 1 --ok--> repetition 2, interval 3
 *   ...
 *   repetition n --ok--> repetition n+1, interval ladder[min(n, last)]
 *   any          --again--> repetition 0, interval 1
 * </pre>
 *
 * Once the top rung is reached the interval stays there. Every interval is clamped to
 * {@code maxIntervalDays}, so the sequence is non-decreasing and bounded.
 */
public class LadderIntervalPolicy implements IntervalPolicy {

    private final List<Integer> ladder;
    private final int maxIntervalDays;

    public LadderIntervalPolicy(List<Integer> ladder, int maxIntervalDays) {
        if (ladder == null || ladder.isEmpty()) {
            throw new IllegalArgumentException("Interval ladder must not be empty");
        }
        this.ladder = ladder.stream().sorted().toList();
        this.maxIntervalDays = maxIntervalDays;
    }

    @Override
    public ReviewComputation apply(SchedulingState state, Grade grade, Instant now) {
        int repetition;
        int interval;

        if (!grade.isPassing()) {
            repetition = 0;
            interval = 1;
        } else {
            repetition = Math.max(0, state.repetition()) + 1;
            int rung = Math.min(repetition - 1, ladder.size() - 1);
            interval = ladder.get(rung);
        }

        interval = SchedulingAlgoUtils.clampInterval(interval, maxIntervalDays);
        return new ReviewComputation(grade, repetition, interval, state.easiness(), now,
                SchedulingAlgoUtils.plusDays(now, interval));
    }

    @Override
    public List<Grade> grades() {
        return List.of(Grade.AGAIN, Grade.OK);
    }
}
