package com.project.recall.backend.service;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.algorithm.ReviewComputation;

import java.time.Instant;
import java.util.UUID;

public record ReviewOutcome(UUID cardId, Grade grade, int repetition, int intervalDays, double easiness,
                            Instant nextReviewAt) {

    static ReviewOutcome of(UUID cardId, ReviewComputation result) {
        return new ReviewOutcome(cardId, result.grade(), result.repetition(), result.intervalDays(),
                result.easiness(), result.nextReviewAt());
    }
}
