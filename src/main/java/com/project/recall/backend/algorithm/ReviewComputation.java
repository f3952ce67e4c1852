package com.project.recall.backend.algorithm;

import java.time.Instant;

/**
 * Result of applying a grade to a card.
 *
 * @param grade        the grade that produced this result.
 * @param repetition   successful reviews since the last reset.
 * @param intervalDays days until the next review (always ≥ 1).
 * @param easiness     easiness after the review (unchanged by fixed and ladder policies).
 * @param reviewedAt   when the grade was applied.
 * @param nextReviewAt {@code reviewedAt + intervalDays}.
 */
public record ReviewComputation(
        Grade grade,
        int repetition,
        int intervalDays,
        double easiness,
        Instant reviewedAt,
        Instant nextReviewAt
) {
}
