package com.project.recall.backend.entity;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@Entity
@Table(name = "app_users")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class AppUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Integer uid;

    @Column(name = "firstname")
    String firstName;

    @Column(name = "lastname")
    String lastName;

    @Column(name = "username", unique = true)
    String username;

    @Column(name = "password")
    String password;

    /** Telegram user id; also the id of the user's direct chat with the bot. */
    @Column(name = "telegram_user_id", unique = true)
    Long telegramUserId;

    /** Where reviews are delivered when set (a channel or group); otherwise the direct chat. */
    @Column(name = "notification_chat_id")
    String notificationChatId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    UserStatus status = UserStatus.PENDING;
}
