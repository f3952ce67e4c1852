package com.project.recall.backend.dto;

import com.project.recall.backend.entity.Card;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CardDto {
    private UUID id;
    private String status;
    private String reminderMode;
    private String contentKind;
    private String contentPreview;
    private List<Integer> sourceMessageIds;
    private int repetition;
    private int intervalDays;
    private double easiness;
    private Instant nextReviewAt;
    private Instant awaitingGradeSince;
    private Instant lastReviewedAt;
    private String lastGrade;

    public static CardDto from(Card card) {
        return new CardDto(
                card.getId(),
                card.getStatus().getValue(),
                card.getReminderMode().getValue(),
                card.getContentKind().name(),
                card.getContentPreview(),
                List.copyOf(card.getSourceMessageIds()),
                card.getRepetition(),
                card.getIntervalDays(),
                card.getEasiness(),
                card.getNextReviewAt(),
                card.getAwaitingGradeSince(),
                card.getLastReviewedAt(),
                card.getLastGrade() == null ? null : card.getLastGrade().getKey());
    }
}
