package com.project.recall.backend.algorithm;

/**
 * The user's self-assessment of recall, as pressed on the grading keyboard.
 *
 * Each grade carries the SM-2 "quality" value it stands for and the key used in
 * callback data. {@link #AGAIN} is the only failing grade; {@link #OK} is the single
 * passing grade of the two-button ladder keyboard and weighs like {@link #GOOD}.
 *
 * <pre>
 *  again = 0   (failed, start over)
 *  hard  = 3
 *  good  = 4
 *  easy  = 5
 *  ok    = 4   (ladder keyboard)
 * </pre>
 */
public enum Grade {

    AGAIN("again", 0),
    HARD("hard", 3),
    GOOD("good", 4),
    EASY("easy", 5),
    OK("ok", 4);

    private final String key;
    private final int quality;

    Grade(String key, int quality) {
        this.key = key;
        this.quality = quality;
    }

    public String getKey() {
        return key;
    }

    public int getQuality() {
        return quality;
    }

    public boolean isPassing() {
        return quality >= 3;
    }

    /**
     * Resolves a grade from its callback key, ignoring case.
     *
     * @throws IllegalArgumentException if the key names no grade.
     */
    public static Grade fromKey(String key) {
        for (Grade grade : values()) {
            if (grade.key.equalsIgnoreCase(key)) {
                return grade;
            }
        }
        throw new IllegalArgumentException("Unknown grade: " + key);
    }
}
