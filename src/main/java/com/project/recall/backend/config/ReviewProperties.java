package com.project.recall.backend.config;

import com.project.recall.backend.algorithm.Grade;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All tunables of the review core, bound from the {@code review.*} namespace.
 *
 * One instance is handed to the scheduler, the dispatcher, the sweeper and the interval engine
 * at construction time, so nothing below reads the environment on its own.
 */
@Data
@Component
@ConfigurationProperties(prefix = "review")
public class ReviewProperties {

    private Scheduler scheduler = new Scheduler();

    private Interval interval = new Interval();

    private Sweeper sweeper = new Sweeper();

    private Delivery delivery = new Delivery();

    private Telegram telegram = new Telegram();

    @Data
    public static class Scheduler {
        /**
         * Whether the periodic loop is started with the application context.
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one tick and the start of the next.
         */
        private Duration scanInterval = Duration.ofSeconds(60);

        /**
         * Maximum number of due cards dispatched per tick.
         */
        private int batchSize = 5;

        /**
         * How long {@code stop()} waits for an in-flight tick.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Interval {
        /**
         * Delay before a freshly activated card surfaces for the first time.
         */
        private int initialDelayMinutes = 10;

        /**
         * Upper bound for every computed interval.
         */
        private int maxIntervalDays = 365;

        /**
         * Which policy governs cards in adaptive reminder mode.
         */
        private AdaptivePolicy adaptivePolicy = AdaptivePolicy.EASE;

        /**
         * Interval ladder (days) walked by the ladder policy.
         */
        private List<Integer> ladder = new ArrayList<>(List.of(1, 3, 7, 14, 30));

        /**
         * Intervals (days) offered by the "adjust" action.
         */
        private List<Integer> presets = new ArrayList<>(List.of(1, 3, 7, 14, 30));

        /**
         * Easiness assigned to new cards.
         */
        private double defaultEasiness = 2.5;
    }

    public enum AdaptivePolicy {
        EASE,
        LADDER
    }

    @Data
    public static class Sweeper {
        /**
         * How long a card may stay awaiting a grade before it is reclaimed.
         */
        private Duration awaitingTimeout = Duration.ofHours(12);

        private TimeoutPolicy timeoutPolicy = TimeoutPolicy.REVERT;

        /**
         * Grade applied to expired cards when the policy is {@link TimeoutPolicy#AUTO_GRADE}.
         */
        private Grade autoGrade = Grade.AGAIN;
    }

    public enum TimeoutPolicy {
        /** Return the card to learning untouched; it is due again on the next tick. */
        REVERT,
        /** Grade the card with {@link Sweeper#getAutoGrade()} and schedule it normally. */
        AUTO_GRADE
    }

    @Data
    public static class Delivery {
        /**
         * How far a card is pushed back after a failed delivery.
         */
        private Duration retryBackoff = Duration.ofHours(1);

        /**
         * Text of the lightweight reminder sent as a reply to the base message.
         */
        private String reminderText = "🔔 Time to review this card";

        /**
         * Attempts made for a store call that fails with a transient fault.
         */
        private int storeRetryAttempts = 3;

        /**
         * Base delay between store attempts; attempt n waits n times this.
         */
        private Duration storeRetryDelay = Duration.ofMillis(1500);
    }

    @Data
    public static class Telegram {
        /**
         * Bot token used for every outbound call; required.
         */
        private String botToken;
    }
}
