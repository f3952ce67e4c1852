package com.project.recall.backend.algorithm;

import com.project.recall.backend.config.ReviewProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Entry point of the interval computation.
 *
 * Picks the {@link IntervalPolicy} for a card's {@link ReminderMode}:
 * <pre>
 *   ADAPTIVE     → ease (SM-2) or ladder, per review.interval.adaptive-policy
 *   FIXED_DAILY  → fixed, 1 day
 *   FIXED_WEEKLY → fixed, 7 days
 * </pre>
 * and exposes the two other time computations the core needs: the first review date of a
 * freshly activated card and the preset intervals of the "adjust" action.
 */
@Component
public class IntervalEngine {

    private static final int DAILY_INTERVAL_DAYS = 1;
    private static final int WEEKLY_INTERVAL_DAYS = 7;

    private final ReviewProperties.Interval settings;
    private final IntervalPolicy adaptivePolicy;
    private final IntervalPolicy dailyPolicy;
    private final IntervalPolicy weeklyPolicy;

    public IntervalEngine(ReviewProperties properties) {
        this.settings = properties.getInterval();
        int maxIntervalDays = settings.getMaxIntervalDays();
        this.adaptivePolicy = settings.getAdaptivePolicy() == ReviewProperties.AdaptivePolicy.LADDER
                ? new LadderIntervalPolicy(settings.getLadder(), maxIntervalDays)
                : new EaseIntervalPolicy(maxIntervalDays);
        this.dailyPolicy = new FixedIntervalPolicy(DAILY_INTERVAL_DAYS, maxIntervalDays);
        this.weeklyPolicy = new FixedIntervalPolicy(WEEKLY_INTERVAL_DAYS, maxIntervalDays);
    }

    public ReviewComputation computeReview(ReminderMode mode, SchedulingState state, Grade grade, Instant now) {
        return policyFor(mode).apply(state, grade, now);
    }

    public IntervalPolicy policyFor(ReminderMode mode) {
        if (mode == null) {
            return adaptivePolicy;
        }
        return switch (mode) {
            case FIXED_DAILY -> dailyPolicy;
            case FIXED_WEEKLY -> weeklyPolicy;
            case ADAPTIVE -> adaptivePolicy;
        };
    }

    /**
     * The first review of a new card is minutes away, not days, so it surfaces quickly for
     * its first rehearsal.
     */
    public Instant initialReviewAt(Instant now) {
        int minutes = Math.max(1, settings.getInitialDelayMinutes());
        return now.plus(minutes, ChronoUnit.MINUTES);
    }

    /**
     * Preset intervals not above the configured maximum; the maximum itself when every
     * preset exceeds it.
     */
    public List<Integer> presetIntervals() {
        int max = Math.max(1, settings.getMaxIntervalDays());
        List<Integer> presets = settings.getPresets().stream()
                .filter(days -> days >= 1 && days <= max)
                .sorted()
                .toList();
        return presets.isEmpty() ? List.of(max) : presets;
    }

    public int clampInterval(int intervalDays) {
        return SchedulingAlgoUtils.clampInterval(intervalDays, settings.getMaxIntervalDays());
    }

    public double defaultEasiness() {
        return settings.getDefaultEasiness();
    }
}
