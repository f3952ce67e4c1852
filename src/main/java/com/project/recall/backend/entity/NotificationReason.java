package com.project.recall.backend.entity;

/**
 * Why a card was put in front of the user.
 */
public enum NotificationReason {

    SCHEDULED("scheduled"),
    MANUAL_NOW("manual_now"),
    MANUAL_OVERRIDE("manual_override");

    private final String value;

    NotificationReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static NotificationReason fromValue(String value) {
        for (NotificationReason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown notification reason: " + value);
    }
}
