package com.project.recall.backend.service;

import com.project.recall.backend.algorithm.IntervalEngine;
import com.project.recall.backend.config.ReviewProperties;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.NotificationReason;
import com.project.recall.backend.messaging.GradingControls;
import com.project.recall.backend.messaging.MessagingGateway;
import com.project.recall.backend.messaging.ReplyTargetMissingException;
import com.project.recall.backend.messaging.SentMessage;
import com.project.recall.backend.messaging.SourceRef;
import com.project.recall.backend.store.CardStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Puts a card in front of its owner with a grading keyboard attached.
 *
 * The first delivery copies the original content (every message of a media group, in
 * order) and remembers the last copy as the card's base message. Later deliveries only send a
 * short reminder replying to that base message, so photos and videos are not re-sent on
 * every review. If the base message is gone, the content is copied again and the new copy
 * becomes the base.
 *
 * A delivery that cannot complete pushes the card back by the configured backoff and leaves
 * it in learning.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final CardStore cardStore;
    private final MessagingGateway messagingGateway;
    private final AppUserService appUserService;
    private final IntervalEngine intervalEngine;
    private final ReviewProperties.Delivery settings;
    private final Clock clock;

    public NotificationDispatcher(CardStore cardStore,
                                  MessagingGateway messagingGateway,
                                  AppUserService appUserService,
                                  IntervalEngine intervalEngine,
                                  ReviewProperties properties,
                                  Clock clock) {
        this.cardStore = cardStore;
        this.messagingGateway = messagingGateway;
        this.appUserService = appUserService;
        this.intervalEngine = intervalEngine;
        this.settings = properties.getDelivery();
        this.clock = clock;
    }

    public DeliveryResult dispatch(Card card, NotificationReason reason) {
        String target;
        Delivery delivery;
        Instant sentAt;
        try {
            target = appUserService.resolveDeliveryTarget(card.getUserId());
            GradingControls controls = new GradingControls(card.getId(),
                    intervalEngine.policyFor(card.getReminderMode()).grades());

            delivery = deliver(card, target, controls);

            sentAt = Instant.now(clock);
            if (!cardStore.markAwaitingGrade(card.getId(), target, delivery.messageId(), sentAt)) {
                log.warn("Card {} changed state while it was being delivered, withdrawing message {}",
                        card.getId(), delivery.messageId());
                withdraw(target, delivery);
                return DeliveryResult.superseded(card.getId());
            }
        } catch (RuntimeException e) {
            return rescheduleAfterFailure(card, e);
        }

        // the card is awaiting a grade from here on; the history row is not part of delivery
        try {
            cardStore.recordNotification(card.getId(), target, delivery.messageId(), reason, sentAt);
        } catch (RuntimeException e) {
            log.error("Card {} was delivered as message {} but its notification could not be recorded",
                    card.getId(), delivery.messageId(), e);
        }

        log.info("Delivered card {} to {} ({}){}", card.getId(), target, reason.getValue(),
                delivery.copied() ? "" : " as reply");
        return DeliveryResult.delivered(card.getId(), delivery.messageId(), delivery.copied());
    }

    /**
     * Best-effort removal of the grading keyboard from the card's pending message. A failure
     * only leaves stale buttons behind, so it is logged and swallowed.
     */
    public void clearControlsQuietly(Card card) {
        if (!card.hasPendingMessage()) {
            return;
        }
        try {
            messagingGateway.clearControls(card.getPendingChannelId(), card.getPendingChannelMessageId());
        } catch (RuntimeException e) {
            log.warn("Could not clear the keyboard of card {} (message {}): {}",
                    card.getId(), card.getPendingChannelMessageId(), e.getMessage());
        }
    }

    private Delivery deliver(Card card, String target, GradingControls controls) {
        Integer baseMessageId = card.getBaseChannelMessageId();
        if (baseMessageId == null) {
            return copyOriginal(card, target, controls);
        }

        try {
            SentMessage reminder = messagingGateway.sendText(target, settings.getReminderText(), baseMessageId, controls);
            if (!reminder.isReply()) {
                log.warn("Reminder for card {} was not attached to base message {}, copying the content again",
                        card.getId(), baseMessageId);
                deleteQuietly(target, reminder.messageId());
                return copyOriginal(card, target, controls);
            }
            return new Delivery(reminder.messageId(), false);
        } catch (ReplyTargetMissingException e) {
            log.warn("Base message {} of card {} no longer exists, copying the content again",
                    baseMessageId, card.getId());
            cardStore.setBaseMessage(card.getId(), null);
            return copyOriginal(card, target, controls);
        }
    }

    private Delivery copyOriginal(Card card, String target, GradingControls controls) {
        SourceRef source = new SourceRef(card.getSourceChatId(), card.getSourceMessageIds());
        List<Integer> copies = messagingGateway.copyContent(target, source, controls);
        if (copies.isEmpty()) {
            throw new IllegalStateException("Copying card " + card.getId() + " produced no message");
        }
        int lastCopy = copies.get(copies.size() - 1);
        cardStore.setBaseMessage(card.getId(), lastCopy);
        return new Delivery(lastCopy, true);
    }

    private void withdraw(String target, Delivery delivery) {
        if (delivery.copied()) {
            // the copy is now the base message; keep it and just drop its buttons
            try {
                messagingGateway.clearControls(target, delivery.messageId());
            } catch (RuntimeException e) {
                log.warn("Could not clear the keyboard of withdrawn message {}: {}", delivery.messageId(), e.getMessage());
            }
        } else {
            deleteQuietly(target, delivery.messageId());
        }
    }

    private void deleteQuietly(String chatId, int messageId) {
        try {
            messagingGateway.deleteMessage(chatId, messageId);
        } catch (RuntimeException e) {
            log.warn("Could not delete message {} in {}: {}", messageId, chatId, e.getMessage());
        }
    }

    private DeliveryResult rescheduleAfterFailure(Card card, RuntimeException cause) {
        Instant retryAt = Instant.now(clock).plus(settings.getRetryBackoff());
        log.error("Failed to deliver card {}, retrying at {}", card.getId(), retryAt, cause);
        try {
            if (!cardStore.reschedule(card.getId(), retryAt)) {
                log.warn("Card {} is no longer learning, retry was not scheduled", card.getId());
            }
        } catch (RuntimeException e) {
            log.error("Could not reschedule card {} after a failed delivery", card.getId(), e);
        }
        return DeliveryResult.failed(card.getId(), retryAt);
    }

    private record Delivery(int messageId, boolean copied) {
    }
}
