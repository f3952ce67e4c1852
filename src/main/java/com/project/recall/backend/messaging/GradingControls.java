package com.project.recall.backend.messaging;

import com.project.recall.backend.algorithm.Grade;

import java.util.List;
import java.util.UUID;

/**
 * The grading keyboard attached to a delivered card: one button per grade, plus an
 * "adjust" button opening the preset intervals.
 */
public record GradingControls(UUID cardId, List<Grade> grades) {

    public static final String GRADE_ACTION = "grade";
    public static final String ADJUST_ACTION = "adjust";

    public GradingControls {
        grades = List.copyOf(grades);
    }

    public String gradeCallback(Grade grade) {
        return GRADE_ACTION + "|" + cardId + "|" + grade.getKey();
    }

    public String adjustCallback() {
        return ADJUST_ACTION + "|" + cardId;
    }
}
