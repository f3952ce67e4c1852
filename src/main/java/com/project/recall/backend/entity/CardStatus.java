package com.project.recall.backend.entity;

/**
 * Lifecycle state of a card.
 *
 * <pre>
 *  pending        – captured, not yet confirmed by the user; never scheduled.
 *  learning       – scheduled; due once nextReviewAt has passed.
 *  awaiting_grade – delivered, grading keyboard live, waiting for the user.
 *  archived       – parked by the user; the scheduler skips it.
 * </pre>
 */
public enum CardStatus {

    PENDING("pending"),
    LEARNING("learning"),
    AWAITING_GRADE("awaiting_grade"),
    ARCHIVED("archived");

    private final String value;

    CardStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CardStatus fromValue(String value) {
        for (CardStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown card status: " + value);
    }
}
