package com.project.recall.backend.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One completed delivery of a card. Append-only.
 */
@Getter
@Setter
@Entity
@Table(name = "card_notifications", indexes = {
        @Index(name = "idx_card_notifications_card", columnList = "card_id, sent_at")
})
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class CardNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "card_id", nullable = false)
    private UUID cardId;

    @Column(name = "chat_id", nullable = false)
    private String chatId;

    @Column(name = "message_id", nullable = false)
    private Integer messageId;

    @Convert(converter = EnumValueConverters.NotificationReasonConverter.class)
    @Column(name = "reason", nullable = false, length = 20)
    private NotificationReason reason;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;
}
