package com.project.recall.backend.store;

import com.project.recall.backend.algorithm.ReviewComputation;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardNotification;
import com.project.recall.backend.entity.NotificationReason;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The narrow set of operations the review core performs on cards.
 *
 * Transitions return {@code true} when they applied and {@code false} when the card was not
 * in the state the transition starts from; they never throw for that case. Each one is a
 * single atomic update of one card.
 */
public interface CardStore {

    /**
     * Learning cards whose next review has passed, oldest due first.
     */
    List<Card> listDueCards(int limit);

    /**
     * Cards awaiting a grade since {@code cutoff} or earlier.
     */
    List<Card> listExpiredAwaiting(Instant cutoff);

    /**
     * @throws com.project.recall.backend.exception.CardNotFoundException if no such card.
     */
    Card getCard(UUID cardId);

    Card createPending(Card card);

    /** pending → learning. */
    boolean activate(UUID cardId, Instant nextReviewAt);

    /** learning (with no pending message) → awaiting_grade. */
    boolean markAwaitingGrade(UUID cardId, String channelId, int messageId, Instant since);

    /**
     * awaiting_grade → learning, pending message forgotten. Also releases a pending message
     * left behind on a learning card.
     */
    boolean clearAwaitingGrade(UUID cardId);

    /** awaiting_grade → learning with the computed schedule. */
    boolean saveReviewResult(UUID cardId, ReviewComputation result);

    void setBaseMessage(UUID cardId, Integer messageId);

    /**
     * Moves the next review of a learning card; used after a failed delivery.
     */
    boolean reschedule(UUID cardId, Instant nextReviewAt);

    void recordNotification(UUID cardId, String chatId, int messageId, NotificationReason reason, Instant sentAt);

    List<CardNotification> listNotifications(UUID cardId);

    /** learning / awaiting_grade → archived. */
    boolean archive(UUID cardId);

    /** archived → learning. */
    boolean restore(UUID cardId);

    /** learning / awaiting_grade → learning at {@code nextReviewAt}. */
    boolean postpone(UUID cardId, Instant nextReviewAt);

    /** Sets the next review of any scheduled card without touching its status. */
    boolean overrideNextReview(UUID cardId, Instant nextReviewAt);

    /** awaiting_grade → learning with an interval chosen by the user. */
    boolean applyInterval(UUID cardId, int intervalDays, Instant nextReviewAt);

    /** Deletes the card only while it is still pending. */
    boolean deletePending(UUID cardId);

    boolean delete(UUID cardId);
}
