package com.project.recall.backend.algorithm;

import java.time.Instant;
import java.util.List;

/**
 * A rule that turns a grade into the next review date.
 *
 * Implementations are pure: no clock, no store, no side effects. The caller passes
 * "now" so that results are reproducible.
 */
public interface IntervalPolicy {

    ReviewComputation apply(SchedulingState state, Grade grade, Instant now);

    /**
     * The grades offered on the keyboard for cards governed by this policy.
     */
    List<Grade> grades();
}
