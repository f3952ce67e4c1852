package com.project.recall.backend.entity;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.algorithm.ReminderMode;
import com.project.recall.backend.algorithm.SchedulingState;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A learning item tracked through the spaced-repetition lifecycle.
 *
 * State transitions after creation are not done through this entity: the store issues
 * conditional updates keyed by the card's current status (see {@code CardRepository}), and
 * instances handed out by the store are snapshots.
 */
@Getter
@Setter
@Entity
@Table(name = "cards", indexes = {
        @Index(name = "idx_cards_status_next_review", columnList = "status, next_review_at"),
        @Index(name = "idx_cards_status_awaiting_since", columnList = "status, awaiting_grade_since")
})
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class Card {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Integer userId;

    // ── source ────────────────────────────────────────────────────────────

    @Column(name = "source_chat_id", nullable = false)
    private String sourceChatId;

    /**
     * Message ids of the original content, in original order. More than one entry means
     * the card was captured from a media group.
     */
    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "card_source_messages", joinColumns = @JoinColumn(name = "card_id"))
    @OrderColumn(name = "position")
    @Column(name = "message_id", nullable = false)
    private List<Integer> sourceMessageIds = new ArrayList<>();

    // ── content ───────────────────────────────────────────────────────────

    @Enumerated(EnumType.STRING)
    @Column(name = "content_kind", nullable = false, length = 16)
    private ContentKind contentKind;

    @Column(name = "content_preview", length = 200)
    private String contentPreview;

    @Column(name = "content_file_id")
    private String contentFileId;

    @Column(name = "content_file_unique_id")
    private String contentFileUniqueId;

    // ── scheduling ────────────────────────────────────────────────────────

    @Convert(converter = EnumValueConverters.CardStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private CardStatus status;

    @Builder.Default
    @Convert(converter = EnumValueConverters.ReminderModeConverter.class)
    @Column(name = "reminder_mode", nullable = false, length = 10)
    private ReminderMode reminderMode = ReminderMode.ADAPTIVE;

    @Builder.Default
    @Column(name = "repetition", nullable = false)
    private int repetition = 0;

    @Builder.Default
    @Column(name = "interval_days", nullable = false)
    private int intervalDays = 0;

    @Builder.Default
    @Column(name = "easiness", nullable = false)
    private double easiness = 2.5;

    @Column(name = "next_review_at")
    private Instant nextReviewAt;

    // ── delivery bookkeeping ──────────────────────────────────────────────

    /** Chat holding the message that currently carries the grading keyboard. */
    @Column(name = "pending_channel_id")
    private String pendingChannelId;

    @Column(name = "pending_channel_message_id")
    private Integer pendingChannelMessageId;

    /** First delivered copy of the content; later reminders reply to it. */
    @Column(name = "base_channel_message_id")
    private Integer baseChannelMessageId;

    @Column(name = "awaiting_grade_since")
    private Instant awaitingGradeSince;

    @Column(name = "last_notification_at")
    private Instant lastNotificationAt;

    @Convert(converter = EnumValueConverters.NotificationReasonConverter.class)
    @Column(name = "last_notification_reason", length = 20)
    private NotificationReason lastNotificationReason;

    @Column(name = "last_notification_message_id")
    private Integer lastNotificationMessageId;

    // ── audit ─────────────────────────────────────────────────────────────

    @Column(name = "last_reviewed_at")
    private Instant lastReviewedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_grade", length = 10)
    private Grade lastGrade;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SchedulingState schedulingState() {
        return new SchedulingState(repetition, intervalDays, easiness);
    }

    /**
     * True while a message with a live grading keyboard is recorded for this card.
     */
    public boolean hasPendingMessage() {
        return pendingChannelId != null && pendingChannelMessageId != null;
    }
}
