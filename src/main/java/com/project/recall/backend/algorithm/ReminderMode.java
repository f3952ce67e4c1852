package com.project.recall.backend.algorithm;

/**
 * Selects which interval policy governs a card.
 *
 * We store this as a short string in the database (the values the bot has always used):
 *
 * <pre>
 *  sm2    = ADAPTIVE     – interval grows with the user's grades.
 *  daily  = FIXED_DAILY  – every day, grade ignored.
 *  weekly = FIXED_WEEKLY – every seven days, grade ignored.
 * </pre>
 */
public enum ReminderMode {

    ADAPTIVE("sm2"),
    FIXED_DAILY("daily"),
    FIXED_WEEKLY("weekly");

    private final String value;

    ReminderMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ReminderMode fromValue(String value) {
        for (ReminderMode mode : values()) {
            if (mode.value.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown reminder mode: " + value);
    }
}
