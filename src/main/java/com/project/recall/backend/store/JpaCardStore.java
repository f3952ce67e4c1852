package com.project.recall.backend.store;

import com.project.recall.backend.algorithm.ReviewComputation;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardNotification;
import com.project.recall.backend.entity.CardStatus;
import com.project.recall.backend.entity.NotificationReason;
import com.project.recall.backend.exception.CardNotFoundException;
import com.project.recall.backend.repository.CardNotificationRepository;
import com.project.recall.backend.repository.CardRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component("jpaCardStore")
public class JpaCardStore implements CardStore {

    private static final EnumSet<CardStatus> ACTIVE = EnumSet.of(CardStatus.LEARNING, CardStatus.AWAITING_GRADE);
    private static final EnumSet<CardStatus> SCHEDULED =
            EnumSet.of(CardStatus.LEARNING, CardStatus.AWAITING_GRADE, CardStatus.ARCHIVED);

    private final CardRepository cardRepository;
    private final CardNotificationRepository notificationRepository;
    private final Clock clock;

    public JpaCardStore(CardRepository cardRepository,
                        CardNotificationRepository notificationRepository,
                        Clock clock) {
        this.cardRepository = cardRepository;
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> listDueCards(int limit) {
        return cardRepository.findDue(CardStatus.LEARNING, Instant.now(clock), PageRequest.of(0, Math.max(1, limit)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Card> listExpiredAwaiting(Instant cutoff) {
        return cardRepository.findAwaitingSince(CardStatus.AWAITING_GRADE, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public Card getCard(UUID cardId) {
        return cardRepository.findById(cardId).orElseThrow(() -> new CardNotFoundException(cardId));
    }

    @Override
    @Transactional
    public Card createPending(Card card) {
        if (card.getId() == null) {
            card.setId(UUID.randomUUID());
        }
        card.setStatus(CardStatus.PENDING);
        card.setNextReviewAt(null);
        card.setPendingChannelId(null);
        card.setPendingChannelMessageId(null);
        card.setBaseChannelMessageId(null);
        card.setAwaitingGradeSince(null);
        return cardRepository.save(card);
    }

    @Override
    public boolean activate(UUID cardId, Instant nextReviewAt) {
        return cardRepository.activate(cardId, nextReviewAt, Instant.now(clock),
                CardStatus.PENDING, CardStatus.LEARNING) > 0;
    }

    @Override
    public boolean markAwaitingGrade(UUID cardId, String channelId, int messageId, Instant since) {
        return cardRepository.markAwaitingGrade(cardId, channelId, messageId, since,
                CardStatus.LEARNING, CardStatus.AWAITING_GRADE) > 0;
    }

    @Override
    public boolean clearAwaitingGrade(UUID cardId) {
        return cardRepository.clearAwaitingGrade(cardId, Instant.now(clock),
                CardStatus.AWAITING_GRADE, CardStatus.LEARNING) > 0;
    }

    @Override
    public boolean saveReviewResult(UUID cardId, ReviewComputation result) {
        return cardRepository.saveReviewResult(cardId, result.grade(), result.repetition(), result.intervalDays(),
                result.easiness(), result.reviewedAt(), result.nextReviewAt(),
                CardStatus.AWAITING_GRADE, CardStatus.LEARNING) > 0;
    }

    @Override
    public void setBaseMessage(UUID cardId, Integer messageId) {
        cardRepository.setBaseMessage(cardId, messageId);
    }

    @Override
    public boolean reschedule(UUID cardId, Instant nextReviewAt) {
        return cardRepository.updateNextReview(cardId, nextReviewAt, Instant.now(clock),
                EnumSet.of(CardStatus.LEARNING)) > 0;
    }

    @Override
    @Transactional
    public void recordNotification(UUID cardId, String chatId, int messageId, NotificationReason reason, Instant sentAt) {
        cardRepository.recordNotification(cardId, messageId, reason, sentAt);
        notificationRepository.save(CardNotification.builder()
                .cardId(cardId)
                .chatId(chatId)
                .messageId(messageId)
                .reason(reason)
                .sentAt(sentAt)
                .build());
    }

    @Override
    @Transactional(readOnly = true)
    public List<CardNotification> listNotifications(UUID cardId) {
        return notificationRepository.findByCardIdOrderBySentAtAsc(cardId);
    }

    @Override
    public boolean archive(UUID cardId) {
        return cardRepository.archive(cardId, Instant.now(clock), ACTIVE, CardStatus.ARCHIVED) > 0;
    }

    @Override
    public boolean restore(UUID cardId) {
        return cardRepository.restore(cardId, Instant.now(clock), CardStatus.ARCHIVED, CardStatus.LEARNING) > 0;
    }

    @Override
    public boolean postpone(UUID cardId, Instant nextReviewAt) {
        return cardRepository.moveToLearning(cardId, nextReviewAt, Instant.now(clock), ACTIVE, CardStatus.LEARNING) > 0;
    }

    @Override
    public boolean overrideNextReview(UUID cardId, Instant nextReviewAt) {
        return cardRepository.updateNextReview(cardId, nextReviewAt, Instant.now(clock), SCHEDULED) > 0;
    }

    @Override
    public boolean applyInterval(UUID cardId, int intervalDays, Instant nextReviewAt) {
        return cardRepository.applyInterval(cardId, intervalDays, nextReviewAt, Instant.now(clock),
                CardStatus.AWAITING_GRADE, CardStatus.LEARNING) > 0;
    }

    @Override
    @Transactional
    public boolean deletePending(UUID cardId) {
        Optional<Card> card = cardRepository.findById(cardId);
        if (card.isEmpty() || card.get().getStatus() != CardStatus.PENDING) {
            return false;
        }
        cardRepository.delete(card.get());
        return true;
    }

    @Override
    @Transactional
    public boolean delete(UUID cardId) {
        Optional<Card> card = cardRepository.findById(cardId);
        if (card.isEmpty()) {
            return false;
        }
        notificationRepository.deleteByCardId(cardId);
        cardRepository.delete(card.get());
        return true;
    }
}
