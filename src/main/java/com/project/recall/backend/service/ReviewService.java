package com.project.recall.backend.service;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.algorithm.IntervalEngine;
import com.project.recall.backend.algorithm.ReminderMode;
import com.project.recall.backend.algorithm.ReviewComputation;
import com.project.recall.backend.dto.NewCardDto;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardNotification;
import com.project.recall.backend.entity.CardStatus;
import com.project.recall.backend.entity.NotificationReason;
import com.project.recall.backend.exception.CardAlreadyGradedException;
import com.project.recall.backend.exception.CardNotFoundException;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.InvalidCardStateException;
import com.project.recall.backend.store.CardStore;
import com.project.recall.backend.utils.EntityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Everything a user does to a card: grading a delivered card, and the lifecycle actions
 * around it (activate, archive, postpone, ...).
 *
 * Each action is one conditional transition in the store. When the transition does not
 * apply, the card is re-read to report why.
 */
@Slf4j
@Service
public class ReviewService {

    private final CardStore cardStore;
    private final IntervalEngine intervalEngine;
    private final NotificationDispatcher dispatcher;
    private final EntityValidator entityValidator;
    private final Clock clock;

    public ReviewService(CardStore cardStore,
                         IntervalEngine intervalEngine,
                         NotificationDispatcher dispatcher,
                         EntityValidator entityValidator,
                         Clock clock) {
        this.cardStore = cardStore;
        this.intervalEngine = intervalEngine;
        this.dispatcher = dispatcher;
        this.entityValidator = entityValidator;
        this.clock = clock;
    }

    /**
     * Applies the user's grade to a card that is waiting for one.
     *
     * @throws InvalidCardStateException if the card is not awaiting a grade.
     * @throws IllegalArgumentException if the grade is not one the card's keyboard offers.
     * @throws CardAlreadyGradedException if another grade or the sweeper got there first.
     */
    public ReviewOutcome applyGrade(UUID cardId, Grade grade) {
        Card card = cardStore.getCard(cardId);
        if (card.getStatus() != CardStatus.AWAITING_GRADE) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_AWAITING_GRADE);
        }
        if (!intervalEngine.policyFor(card.getReminderMode()).grades().contains(grade)) {
            throw new IllegalArgumentException("Grade '" + grade.getKey() + "' is not offered for "
                    + card.getReminderMode().getValue() + " cards");
        }

        ReviewComputation result = intervalEngine.computeReview(card.getReminderMode(), card.schedulingState(),
                grade, Instant.now(clock));
        if (!cardStore.saveReviewResult(cardId, result)) {
            throw new CardAlreadyGradedException(cardId);
        }

        dispatcher.clearControlsQuietly(card);
        log.info("Card {} graded {}: repetition {}, interval {}d, next review {}", cardId, grade.getKey(),
                result.repetition(), result.intervalDays(), result.nextReviewAt());
        return ReviewOutcome.of(cardId, result);
    }

    public Card createPendingCard(Integer userId, NewCardDto newCard) {
        entityValidator.validate(newCard);

        ReminderMode mode = newCard.getReminderMode() == null || newCard.getReminderMode().isBlank()
                ? ReminderMode.ADAPTIVE
                : ReminderMode.fromValue(newCard.getReminderMode());

        Card card = Card.builder()
                .userId(userId)
                .sourceChatId(newCard.getSourceChatId())
                .sourceMessageIds(new ArrayList<>(newCard.getSourceMessageIds()))
                .contentKind(newCard.getContentKind())
                .contentPreview(newCard.getContentPreview())
                .contentFileId(newCard.getContentFileId())
                .contentFileUniqueId(newCard.getContentFileUniqueId())
                .reminderMode(mode)
                .easiness(intervalEngine.defaultEasiness())
                .build();

        Card saved = cardStore.createPending(card);
        log.info("Card {} captured for user {} ({} message(s))", saved.getId(), userId, saved.getSourceMessageIds().size());
        return saved;
    }

    /**
     * Confirms a pending card; its first review is a few minutes away.
     */
    public Card activate(UUID cardId) {
        cardStore.getCard(cardId);
        if (!cardStore.activate(cardId, intervalEngine.initialReviewAt(Instant.now(clock)))) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_PENDING);
        }
        log.info("Card {} activated", cardId);
        return cardStore.getCard(cardId);
    }

    /**
     * Drops a card that was never confirmed.
     */
    public void cancel(UUID cardId) {
        cardStore.getCard(cardId);
        if (!cardStore.deletePending(cardId)) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_PENDING);
        }
        log.info("Pending card {} cancelled", cardId);
    }

    public void delete(UUID cardId) {
        Card card = cardStore.getCard(cardId);
        dispatcher.clearControlsQuietly(card);
        if (!cardStore.delete(cardId)) {
            throw new CardNotFoundException(cardId);
        }
        log.info("Card {} deleted", cardId);
    }

    public Card archive(UUID cardId) {
        Card card = cardStore.getCard(cardId);
        if (card.getStatus() == CardStatus.PENDING) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_ACTIVATED);
        }
        if (!cardStore.archive(cardId)) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_ARCHIVED);
        }
        dispatcher.clearControlsQuietly(card);
        log.info("Card {} archived", cardId);
        return cardStore.getCard(cardId);
    }

    public Card restore(UUID cardId) {
        cardStore.getCard(cardId);
        if (!cardStore.restore(cardId)) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_ARCHIVED);
        }
        log.info("Card {} restored", cardId);
        return cardStore.getCard(cardId);
    }

    /**
     * Pushes the next review {@code minutes} from now; a card waiting for a grade goes back
     * to learning without being graded.
     */
    public Card postpone(UUID cardId, int minutes) {
        Card card = cardStore.getCard(cardId);
        requireScheduled(card);

        Instant nextReviewAt = Instant.now(clock).plus(Math.max(1, minutes), ChronoUnit.MINUTES);
        if (!cardStore.postpone(cardId, nextReviewAt)) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_ARCHIVED);
        }
        dispatcher.clearControlsQuietly(card);
        log.info("Card {} postponed to {}", cardId, nextReviewAt);
        return cardStore.getCard(cardId);
    }

    /**
     * Sets the next review date directly. The card keeps its status.
     *
     * @throws IllegalArgumentException if {@code nextReviewAt} is not in the future.
     */
    public Card overrideNextReview(UUID cardId, Instant nextReviewAt) {
        if (nextReviewAt == null || !nextReviewAt.isAfter(Instant.now(clock))) {
            throw new IllegalArgumentException(ExceptionMessage.NEXT_REVIEW_IN_PAST.toString());
        }
        Card card = cardStore.getCard(cardId);
        if (card.getStatus() == CardStatus.PENDING) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_ACTIVATED);
        }
        if (!cardStore.overrideNextReview(cardId, nextReviewAt)) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_ACTIVATED);
        }
        log.info("Next review of card {} set to {}", cardId, nextReviewAt);
        return cardStore.getCard(cardId);
    }

    /**
     * Answers a delivered card with one of the preset intervals instead of a grade. The
     * repetition and easiness stay as they were.
     *
     * @throws IllegalArgumentException if {@code days} is not one of the presets.
     */
    public Card applyPreset(UUID cardId, int days) {
        if (!intervalEngine.presetIntervals().contains(days)) {
            throw new IllegalArgumentException("Interval must be one of " + intervalEngine.presetIntervals());
        }
        Card card = cardStore.getCard(cardId);
        if (card.getStatus() != CardStatus.AWAITING_GRADE) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_AWAITING_GRADE);
        }

        Instant now = Instant.now(clock);
        if (!cardStore.applyInterval(cardId, days, now.plus(days, ChronoUnit.DAYS))) {
            throw new CardAlreadyGradedException(cardId);
        }
        if (card.hasPendingMessage()) {
            cardStore.recordNotification(cardId, card.getPendingChannelId(), card.getPendingChannelMessageId(),
                    NotificationReason.MANUAL_OVERRIDE, now);
        }
        dispatcher.clearControlsQuietly(card);
        log.info("Card {} set to a {} day interval", cardId, days);
        return cardStore.getCard(cardId);
    }

    public Card getCard(UUID cardId) {
        return cardStore.getCard(cardId);
    }

    /**
     * Loads a card on behalf of a user. Cards of other users are reported as missing.
     */
    public Card getOwnedCard(UUID cardId, Integer userId) {
        Card card = cardStore.getCard(cardId);
        if (!card.getUserId().equals(userId)) {
            throw new CardNotFoundException(cardId);
        }
        return card;
    }

    public List<CardNotification> listNotifications(UUID cardId) {
        return cardStore.listNotifications(cardId);
    }

    private void requireScheduled(Card card) {
        if (card.getStatus() == CardStatus.PENDING) {
            throw new InvalidCardStateException(card.getId(), ExceptionMessage.CARD_NOT_ACTIVATED);
        }
        if (card.getStatus() == CardStatus.ARCHIVED) {
            throw new InvalidCardStateException(card.getId(), ExceptionMessage.CARD_ARCHIVED);
        }
    }
}
