package com.project.recall.backend.algorithm;

/**
 * The slice of a card the interval policies read: how many successful reviews in a row,
 * the current interval in days and the current easiness factor.
 */
public record SchedulingState(int repetition, int intervalDays, double easiness) {
}
