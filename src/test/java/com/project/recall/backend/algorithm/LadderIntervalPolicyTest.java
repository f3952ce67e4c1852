package com.project.recall.backend.algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LadderIntervalPolicy")
class LadderIntervalPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private final LadderIntervalPolicy policy = new LadderIntervalPolicy(List.of(1, 3, 7, 14, 30), 365);

    @Test
    @DisplayName("consecutive passes climb the ladder and stay on the top rung")
    void climbsLadder() {
        SchedulingState state = new SchedulingState(0, 0, 2.5);
        List<Integer> intervals = new ArrayList<>();

        for (int i = 0; i < 7; i++) {
            ReviewComputation result = policy.apply(state, Grade.OK, NOW);
            intervals.add(result.intervalDays());
            state = new SchedulingState(result.repetition(), result.intervalDays(), result.easiness());
        }

        assertThat(intervals).containsExactly(1, 3, 7, 14, 30, 30, 30);
        assertThat(state.repetition()).isEqualTo(7);
    }

    @Test
    @DisplayName("again drops the card to the bottom rung")
    void againResets() {
        ReviewComputation result = policy.apply(new SchedulingState(4, 14, 2.5), Grade.AGAIN, NOW);

        assertThat(result.repetition()).isZero();
        assertThat(result.intervalDays()).isEqualTo(1);
    }

    @Test
    @DisplayName("easiness is left untouched")
    void easinessUntouched() {
        ReviewComputation result = policy.apply(new SchedulingState(1, 1, 2.1), Grade.OK, NOW);

        assertThat(result.easiness()).isEqualTo(2.1);
    }

    @Test
    @DisplayName("rungs above the maximum interval are clamped")
    void clampedToMaximum() {
        LadderIntervalPolicy capped = new LadderIntervalPolicy(List.of(1, 3, 7, 14, 30), 10);

        ReviewComputation result = capped.apply(new SchedulingState(4, 7, 2.5), Grade.OK, NOW);

        assertThat(result.intervalDays()).isEqualTo(10);
    }

    @Test
    @DisplayName("an empty ladder is rejected")
    void emptyLadder() {
        assertThatThrownBy(() -> new LadderIntervalPolicy(List.of(), 365))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("offers the two-grade keyboard")
    void grades() {
        assertThat(policy.grades()).containsExactly(Grade.AGAIN, Grade.OK);
    }
}
