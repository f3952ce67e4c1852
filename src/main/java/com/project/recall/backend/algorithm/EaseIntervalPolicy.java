package com.project.recall.backend.algorithm;

import java.time.Instant;
import java.util.List;

/**
 * The ease-based adaptive policy, a variant of SM-2 with four grades.
 *
 * Logic:
 * <pre>
 *   failing grade (again):
 *       repetition = 0, interval = 1, easiness unchanged
 *
 *   passing grade (hard / good / easy / ok):
 *       repetition += 1
 *       interval    = 1                          if repetition == 1
 *                   = 6                          if repetition == 2
 *                   = round(interval × easiness) otherwise
 *       easiness   += 0.1 − (5 − q) × (0.08 + (5 − q) × 0.02)
 * </pre>
 *
 * The easiness used for the third-and-later interval is the value <em>before</em> this
 * review's nudge, which is what the bot has always done. Easiness is rounded to two
 * decimals and never drops below {@link SchedulingAlgoUtils#MIN_EASINESS}; every interval is
 * clamped into {@code [1, maxIntervalDays]}.
 */
public class EaseIntervalPolicy implements IntervalPolicy {

    private static final int FIRST_SUCCESS_INTERVAL_DAYS = 1;
    private static final int SECOND_SUCCESS_INTERVAL_DAYS = 6;
    private static final int AGAIN_INTERVAL_DAYS = 1;

    private final int maxIntervalDays;

    public EaseIntervalPolicy(int maxIntervalDays) {
        this.maxIntervalDays = maxIntervalDays;
    }

    @Override
    public ReviewComputation apply(SchedulingState state, Grade grade, Instant now) {
        double easiness = state.easiness();
        int repetition = Math.max(0, state.repetition());
        int interval;

        if (!grade.isPassing()) {
            repetition = 0;
            interval = AGAIN_INTERVAL_DAYS;
        } else {
            repetition += 1;
            if (repetition == 1) {
                interval = FIRST_SUCCESS_INTERVAL_DAYS;
            } else if (repetition == 2) {
                interval = SECOND_SUCCESS_INTERVAL_DAYS;
            } else {
                interval = (int) Math.round(state.intervalDays() * easiness);
            }
            easiness = SchedulingAlgoUtils.clampEasiness(easiness + adjustment(grade.getQuality()));
        }

        interval = SchedulingAlgoUtils.clampInterval(interval, maxIntervalDays);
        return new ReviewComputation(grade, repetition, interval, easiness, now,
                SchedulingAlgoUtils.plusDays(now, interval));
    }

    @Override
    public List<Grade> grades() {
        return List.of(Grade.AGAIN, Grade.HARD, Grade.GOOD, Grade.EASY);
    }

    private double adjustment(int quality) {
        int miss = 5 - quality;
        return 0.1 - miss * (0.08 + miss * 0.02);
    }
}
