package com.project.recall.backend.store;

import com.project.recall.backend.algorithm.ReviewComputation;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardNotification;
import com.project.recall.backend.entity.NotificationReason;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The {@link CardStore} the core is wired with: every call goes through the
 * {@link TransientFaultRetryPolicy} before reaching the JPA store.
 */
@Primary
@Component
public class RetryingCardStore implements CardStore {

    private final CardStore delegate;
    private final TransientFaultRetryPolicy retryPolicy;

    public RetryingCardStore(@Qualifier("jpaCardStore") CardStore delegate, TransientFaultRetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public List<Card> listDueCards(int limit) {
        return retryPolicy.call("listDueCards", () -> delegate.listDueCards(limit));
    }

    @Override
    public List<Card> listExpiredAwaiting(Instant cutoff) {
        return retryPolicy.call("listExpiredAwaiting", () -> delegate.listExpiredAwaiting(cutoff));
    }

    @Override
    public Card getCard(UUID cardId) {
        return retryPolicy.call("getCard", () -> delegate.getCard(cardId));
    }

    @Override
    public Card createPending(Card card) {
        return retryPolicy.call("createPending", () -> delegate.createPending(card));
    }

    @Override
    public boolean activate(UUID cardId, Instant nextReviewAt) {
        return retryPolicy.call("activate", () -> delegate.activate(cardId, nextReviewAt));
    }

    @Override
    public boolean markAwaitingGrade(UUID cardId, String channelId, int messageId, Instant since) {
        return retryPolicy.call("markAwaitingGrade",
                () -> delegate.markAwaitingGrade(cardId, channelId, messageId, since));
    }

    @Override
    public boolean clearAwaitingGrade(UUID cardId) {
        return retryPolicy.call("clearAwaitingGrade", () -> delegate.clearAwaitingGrade(cardId));
    }

    @Override
    public boolean saveReviewResult(UUID cardId, ReviewComputation result) {
        return retryPolicy.call("saveReviewResult", () -> delegate.saveReviewResult(cardId, result));
    }

    @Override
    public void setBaseMessage(UUID cardId, Integer messageId) {
        retryPolicy.run("setBaseMessage", () -> delegate.setBaseMessage(cardId, messageId));
    }

    @Override
    public boolean reschedule(UUID cardId, Instant nextReviewAt) {
        return retryPolicy.call("reschedule", () -> delegate.reschedule(cardId, nextReviewAt));
    }

    @Override
    public void recordNotification(UUID cardId, String chatId, int messageId, NotificationReason reason, Instant sentAt) {
        retryPolicy.run("recordNotification",
                () -> delegate.recordNotification(cardId, chatId, messageId, reason, sentAt));
    }

    @Override
    public List<CardNotification> listNotifications(UUID cardId) {
        return retryPolicy.call("listNotifications", () -> delegate.listNotifications(cardId));
    }

    @Override
    public boolean archive(UUID cardId) {
        return retryPolicy.call("archive", () -> delegate.archive(cardId));
    }

    @Override
    public boolean restore(UUID cardId) {
        return retryPolicy.call("restore", () -> delegate.restore(cardId));
    }

    @Override
    public boolean postpone(UUID cardId, Instant nextReviewAt) {
        return retryPolicy.call("postpone", () -> delegate.postpone(cardId, nextReviewAt));
    }

    @Override
    public boolean overrideNextReview(UUID cardId, Instant nextReviewAt) {
        return retryPolicy.call("overrideNextReview", () -> delegate.overrideNextReview(cardId, nextReviewAt));
    }

    @Override
    public boolean applyInterval(UUID cardId, int intervalDays, Instant nextReviewAt) {
        return retryPolicy.call("applyInterval", () -> delegate.applyInterval(cardId, intervalDays, nextReviewAt));
    }

    @Override
    public boolean deletePending(UUID cardId) {
        return retryPolicy.call("deletePending", () -> delegate.deletePending(cardId));
    }

    @Override
    public boolean delete(UUID cardId) {
        return retryPolicy.call("delete", () -> delegate.delete(cardId));
    }
}
