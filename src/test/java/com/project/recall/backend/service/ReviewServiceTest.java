package com.project.recall.backend.service;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.algorithm.IntervalEngine;
import com.project.recall.backend.algorithm.ReminderMode;
import com.project.recall.backend.algorithm.ReviewComputation;
import com.project.recall.backend.config.ReviewProperties;
import com.project.recall.backend.dto.NewCardDto;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardStatus;
import com.project.recall.backend.entity.ContentKind;
import com.project.recall.backend.entity.NotificationReason;
import com.project.recall.backend.exception.CardAlreadyGradedException;
import com.project.recall.backend.exception.CardNotFoundException;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.InvalidCardStateException;
import com.project.recall.backend.store.CardStore;
import com.project.recall.backend.utils.EntityValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReviewService")
class ReviewServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private CardStore cardStore;

    @Mock
    private NotificationDispatcher dispatcher;

    @Mock
    private EntityValidator entityValidator;

    private ReviewService reviewService;

    @BeforeEach
    void setUp() {
        reviewService = new ReviewService(cardStore, new IntervalEngine(new ReviewProperties()), dispatcher,
                entityValidator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("applyGrade")
    class ApplyGrade {

        @Test
        @DisplayName("schedules an awaiting card from its grade and clears the keyboard")
        void gradesAwaitingCard() {
            // given
            Card card = card(CardStatus.AWAITING_GRADE);
            when(cardStore.getCard(card.getId())).thenReturn(card);
            when(cardStore.saveReviewResult(eq(card.getId()), any(ReviewComputation.class))).thenReturn(true);

            // when
            ReviewOutcome outcome = reviewService.applyGrade(card.getId(), Grade.GOOD);

            // then
            assertThat(outcome.repetition()).isEqualTo(3);
            assertThat(outcome.intervalDays()).isEqualTo(15);
            assertThat(outcome.nextReviewAt()).isEqualTo(NOW.plus(15, ChronoUnit.DAYS));

            ArgumentCaptor<ReviewComputation> saved = ArgumentCaptor.forClass(ReviewComputation.class);
            verify(cardStore).saveReviewResult(eq(card.getId()), saved.capture());
            assertThat(saved.getValue().grade()).isEqualTo(Grade.GOOD);
            assertThat(saved.getValue().reviewedAt()).isEqualTo(NOW);
            verify(dispatcher).clearControlsQuietly(card);
        }

        @Test
        @DisplayName("rejects a card that is not awaiting a grade")
        void rejectsLearningCard() {
            Card card = card(CardStatus.LEARNING);
            when(cardStore.getCard(card.getId())).thenReturn(card);

            assertThatThrownBy(() -> reviewService.applyGrade(card.getId(), Grade.EASY))
                    .isInstanceOf(InvalidCardStateException.class)
                    .isNotInstanceOf(CardAlreadyGradedException.class);
            verify(cardStore, never()).saveReviewResult(any(), any());
        }

        @Test
        @DisplayName("rejects a grade the card's keyboard does not offer")
        void rejectsForeignGrade() {
            Card easeCard = card(CardStatus.AWAITING_GRADE);
            Card weeklyCard = card(CardStatus.AWAITING_GRADE);
            weeklyCard.setReminderMode(ReminderMode.FIXED_WEEKLY);
            when(cardStore.getCard(easeCard.getId())).thenReturn(easeCard);
            when(cardStore.getCard(weeklyCard.getId())).thenReturn(weeklyCard);

            assertThatThrownBy(() -> reviewService.applyGrade(easeCard.getId(), Grade.OK))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'ok'");
            assertThatThrownBy(() -> reviewService.applyGrade(weeklyCard.getId(), Grade.HARD))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(cardStore, never()).saveReviewResult(any(), any());
        }

        @Test
        @DisplayName("reports a grade that lost the race as already graded")
        void duplicateGrade() {
            Card card = card(CardStatus.AWAITING_GRADE);
            when(cardStore.getCard(card.getId())).thenReturn(card);
            when(cardStore.saveReviewResult(eq(card.getId()), any(ReviewComputation.class))).thenReturn(false);

            assertThatThrownBy(() -> reviewService.applyGrade(card.getId(), Grade.AGAIN))
                    .isInstanceOf(CardAlreadyGradedException.class);
            verify(dispatcher, never()).clearControlsQuietly(any());
        }
    }

    @Test
    @DisplayName("createPendingCard validates the intake and stores a pending card")
    void createPendingCard() {
        // given
        NewCardDto newCard = NewCardDto.builder()
                .sourceChatId("-100123")
                .sourceMessageIds(List.of(10, 11))
                .contentKind(ContentKind.PHOTO)
                .contentPreview("Mitochondria")
                .reminderMode("weekly")
                .build();
        when(cardStore.createPending(any(Card.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // when
        Card created = reviewService.createPendingCard(7, newCard);

        // then
        verify(entityValidator).validate(newCard);
        assertThat(created.getUserId()).isEqualTo(7);
        assertThat(created.getSourceMessageIds()).containsExactly(10, 11);
        assertThat(created.getReminderMode()).isEqualTo(ReminderMode.FIXED_WEEKLY);
        assertThat(created.getEasiness()).isEqualTo(2.5);
        assertThat(created.getNextReviewAt()).isNull();
    }

    @Test
    @DisplayName("activate schedules the first review after the initial delay")
    void activate() {
        Card card = card(CardStatus.PENDING);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.activate(card.getId(), NOW.plus(10, ChronoUnit.MINUTES))).thenReturn(true);

        reviewService.activate(card.getId());

        verify(cardStore).activate(card.getId(), NOW.plus(10, ChronoUnit.MINUTES));
    }

    @Test
    @DisplayName("activate rejects a card that is no longer pending")
    void activateTwice() {
        Card card = card(CardStatus.LEARNING);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.activate(eq(card.getId()), any())).thenReturn(false);

        assertThatThrownBy(() -> reviewService.activate(card.getId()))
                .isInstanceOf(InvalidCardStateException.class)
                .extracting("reason").isEqualTo(ExceptionMessage.CARD_NOT_PENDING);
    }

    @Test
    @DisplayName("cancel only deletes pending cards")
    void cancel() {
        Card card = card(CardStatus.LEARNING);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.deletePending(card.getId())).thenReturn(false);

        assertThatThrownBy(() -> reviewService.cancel(card.getId())).isInstanceOf(InvalidCardStateException.class);
    }

    @Test
    @DisplayName("archive parks the card and removes the live keyboard")
    void archive() {
        Card card = card(CardStatus.AWAITING_GRADE);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.archive(card.getId())).thenReturn(true);

        reviewService.archive(card.getId());

        verify(dispatcher).clearControlsQuietly(card);
    }

    @Test
    @DisplayName("archive rejects a pending card")
    void archivePending() {
        Card card = card(CardStatus.PENDING);
        when(cardStore.getCard(card.getId())).thenReturn(card);

        assertThatThrownBy(() -> reviewService.archive(card.getId())).isInstanceOf(InvalidCardStateException.class);
        verify(cardStore, never()).archive(any());
    }

    @Test
    @DisplayName("restore rejects a card that is not archived")
    void restoreNotArchived() {
        Card card = card(CardStatus.LEARNING);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.restore(card.getId())).thenReturn(false);

        assertThatThrownBy(() -> reviewService.restore(card.getId()))
                .isInstanceOf(InvalidCardStateException.class)
                .extracting("reason").isEqualTo(ExceptionMessage.CARD_NOT_ARCHIVED);
    }

    @Test
    @DisplayName("postpone moves an awaiting card back to learning at the requested time")
    void postpone() {
        Card card = card(CardStatus.AWAITING_GRADE);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.postpone(card.getId(), NOW.plus(30, ChronoUnit.MINUTES))).thenReturn(true);

        reviewService.postpone(card.getId(), 30);

        verify(cardStore).postpone(card.getId(), NOW.plus(30, ChronoUnit.MINUTES));
        verify(dispatcher).clearControlsQuietly(card);
    }

    @Test
    @DisplayName("the next review cannot be moved into the past")
    void overrideInPast() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> reviewService.overrideNextReview(id, NOW.minusSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(cardStore, never()).overrideNextReview(any(), any());
    }

    @Test
    @DisplayName("a preset interval answers the card and is recorded as a manual override")
    void applyPreset() {
        // given
        Card card = card(CardStatus.AWAITING_GRADE);
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(cardStore.applyInterval(card.getId(), 7, NOW.plus(7, ChronoUnit.DAYS))).thenReturn(true);

        // when
        reviewService.applyPreset(card.getId(), 7);

        // then
        verify(cardStore).recordNotification(card.getId(), "555", 200, NotificationReason.MANUAL_OVERRIDE, NOW);
        verify(dispatcher).clearControlsQuietly(card);
    }

    @Test
    @DisplayName("intervals outside the presets are rejected")
    void applyUnknownPreset() {
        assertThatThrownBy(() -> reviewService.applyPreset(UUID.randomUUID(), 5))
                .isInstanceOf(IllegalArgumentException.class);
        verify(cardStore, never()).applyInterval(any(), anyInt(), any());
    }

    @Test
    @DisplayName("cards of other users are reported as missing")
    void ownership() {
        Card card = card(CardStatus.LEARNING);
        when(cardStore.getCard(card.getId())).thenReturn(card);

        assertThat(reviewService.getOwnedCard(card.getId(), 7)).isSameAs(card);
        assertThatThrownBy(() -> reviewService.getOwnedCard(card.getId(), 8)).isInstanceOf(CardNotFoundException.class);
    }

    private static Card card(CardStatus status) {
        Card card = Card.builder()
                .id(UUID.randomUUID())
                .userId(7)
                .sourceChatId("-100123")
                .sourceMessageIds(List.of(10))
                .contentKind(ContentKind.TEXT)
                .status(status)
                .repetition(2)
                .intervalDays(6)
                .easiness(2.5)
                .build();
        if (status == CardStatus.AWAITING_GRADE) {
            card.setPendingChannelId("555");
            card.setPendingChannelMessageId(200);
            card.setAwaitingGradeSince(NOW.minusSeconds(600));
        }
        if (status != CardStatus.PENDING) {
            card.setNextReviewAt(NOW.minusSeconds(900));
        }
        return card;
    }
}
