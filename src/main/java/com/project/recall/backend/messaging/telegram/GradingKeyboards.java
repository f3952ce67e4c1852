package com.project.recall.backend.messaging.telegram;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.messaging.GradingControls;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.List;

final class GradingKeyboards {

    private GradingKeyboards() {
    }

    static InlineKeyboardMarkup build(GradingControls controls) {
        List<InlineKeyboardButton> gradeRow = controls.grades().stream()
                .map(grade -> button(label(grade), controls.gradeCallback(grade)))
                .toList();
        return InlineKeyboardMarkup.builder()
                .keyboardRow(gradeRow)
                .keyboardRow(List.of(button("⚙️ Adjust", controls.adjustCallback())))
                .build();
    }

    private static InlineKeyboardButton button(String text, String callbackData) {
        return InlineKeyboardButton.builder()
                .text(text)
                .callbackData(callbackData)
                .build();
    }

    private static String label(Grade grade) {
        return switch (grade) {
            case AGAIN -> "🔁 Again";
            case HARD -> "😬 Hard";
            case GOOD -> "🙂 Good";
            case EASY -> "😎 Easy";
            case OK -> "✅ Got it";
        };
    }
}
