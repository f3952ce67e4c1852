package com.project.recall.backend.service;

import com.project.recall.backend.config.ReviewProperties;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardStatus;
import com.project.recall.backend.entity.ContentKind;
import com.project.recall.backend.entity.NotificationReason;
import com.project.recall.backend.exception.CardNotFoundException;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.InvalidCardStateException;
import com.project.recall.backend.store.CardStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReviewScheduler")
class ReviewSchedulerTest {

    private static final Instant DUE = Instant.parse("2026-03-01T08:59:00Z");

    @Mock
    private CardStore cardStore;

    @Mock
    private NotificationDispatcher dispatcher;

    @Mock
    private RecoverySweeper sweeper;

    private ReviewProperties properties;
    private ReviewScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new ReviewProperties();
        scheduler = new ReviewScheduler(cardStore, dispatcher, sweeper, properties);
    }

    @Test
    @DisplayName("a tick dispatches every due card of the batch and then sweeps")
    void tickDispatchesDueCards() {
        // given
        Card first = card(CardStatus.LEARNING);
        Card second = card(CardStatus.LEARNING);
        when(cardStore.listDueCards(5)).thenReturn(List.of(first, second));

        // when
        scheduler.tick();

        // then
        InOrder order = inOrder(dispatcher, sweeper);
        order.verify(dispatcher).dispatch(first, NotificationReason.SCHEDULED);
        order.verify(dispatcher).dispatch(second, NotificationReason.SCHEDULED);
        order.verify(sweeper).sweep();
        verify(cardStore, never()).clearAwaitingGrade(any());
    }

    @Test
    @DisplayName("a due card still holding an old keyboard is released before it is dispatched")
    void tickReleasesStalePendingMessage() {
        // given
        Card stale = card(CardStatus.LEARNING);
        stale.setPendingChannelId("555");
        stale.setPendingChannelMessageId(200);
        Card released = card(CardStatus.LEARNING);
        released.setId(stale.getId());
        when(cardStore.listDueCards(5)).thenReturn(List.of(stale));
        when(cardStore.clearAwaitingGrade(stale.getId())).thenReturn(true);
        when(cardStore.getCard(stale.getId())).thenReturn(released);

        // when
        scheduler.tick();

        // then
        InOrder order = inOrder(dispatcher, cardStore);
        order.verify(dispatcher).clearControlsQuietly(stale);
        order.verify(cardStore).clearAwaitingGrade(stale.getId());
        order.verify(dispatcher).dispatch(released, NotificationReason.SCHEDULED);
    }

    @Test
    @DisplayName("a failure on one card does not stop the batch or the sweep")
    void tickContinuesAfterFailure() {
        // given
        Card broken = card(CardStatus.LEARNING);
        Card healthy = card(CardStatus.LEARNING);
        when(cardStore.listDueCards(5)).thenReturn(List.of(broken, healthy));
        when(dispatcher.dispatch(broken, NotificationReason.SCHEDULED)).thenThrow(new IllegalStateException("boom"));

        // when
        scheduler.tick();

        // then
        verify(dispatcher).dispatch(healthy, NotificationReason.SCHEDULED);
        verify(sweeper).sweep();
    }

    @Test
    @DisplayName("timeouts are still swept when the due batch cannot be loaded")
    void tickSweepsDespiteStoreOutage() {
        when(cardStore.listDueCards(5)).thenThrow(new IllegalStateException("database down"));

        scheduler.tick();

        verify(dispatcher, never()).dispatch(any(), any());
        verify(sweeper).sweep();
    }

    @Test
    @DisplayName("a failing sweep does not escape the tick")
    void tickSurvivesSweepFailure() {
        when(cardStore.listDueCards(5)).thenReturn(List.of());
        when(sweeper.sweep()).thenThrow(new IllegalStateException("database down"));

        scheduler.tick();

        verify(sweeper).sweep();
    }

    @Test
    @DisplayName("a tick started while another is running is skipped")
    void overlappingTickIsSkipped() throws Exception {
        // given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(cardStore.listDueCards(5)).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        Thread running = new Thread(scheduler::tick);
        running.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        scheduler.tick();
        release.countDown();
        running.join(5000);

        // then
        verify(cardStore, times(1)).listDueCards(5);
        verify(sweeper, times(1)).sweep();
    }

    @Test
    @DisplayName("review-now releases an awaiting card and delivers it")
    void triggerImmediateReleasesAwaitingCard() {
        // given
        Card awaiting = card(CardStatus.AWAITING_GRADE);
        awaiting.setPendingChannelId("555");
        awaiting.setPendingChannelMessageId(200);
        Card released = card(CardStatus.LEARNING);
        released.setId(awaiting.getId());
        DeliveryResult delivered = DeliveryResult.delivered(awaiting.getId(), 201, false);
        when(cardStore.getCard(awaiting.getId())).thenReturn(awaiting, released);
        when(cardStore.clearAwaitingGrade(awaiting.getId())).thenReturn(true);
        when(dispatcher.dispatch(released, NotificationReason.MANUAL_NOW)).thenReturn(delivered);

        // when
        DeliveryResult result = scheduler.triggerImmediate(awaiting.getId());

        // then
        assertThat(result).isSameAs(delivered);
        verify(dispatcher).clearControlsQuietly(awaiting);
    }

    @Test
    @DisplayName("review-now delivers a learning card even when it is not due")
    void triggerImmediateLearningCard() {
        Card card = card(CardStatus.LEARNING);
        card.setNextReviewAt(DUE.plus(Duration.ofDays(3)));
        when(cardStore.getCard(card.getId())).thenReturn(card);
        when(dispatcher.dispatch(card, NotificationReason.MANUAL_NOW))
                .thenReturn(DeliveryResult.delivered(card.getId(), 201, false));

        assertThat(scheduler.triggerImmediate(card.getId()).isDelivered()).isTrue();
        verify(cardStore, never()).clearAwaitingGrade(any());
    }

    @Test
    @DisplayName("review-now rejects pending and archived cards")
    void triggerImmediateRejectsInactiveCards() {
        Card pending = card(CardStatus.PENDING);
        Card archived = card(CardStatus.ARCHIVED);
        when(cardStore.getCard(pending.getId())).thenReturn(pending);
        when(cardStore.getCard(archived.getId())).thenReturn(archived);

        assertThatThrownBy(() -> scheduler.triggerImmediate(pending.getId()))
                .isInstanceOf(InvalidCardStateException.class)
                .extracting("reason").isEqualTo(ExceptionMessage.CARD_NOT_ACTIVATED);
        assertThatThrownBy(() -> scheduler.triggerImmediate(archived.getId()))
                .isInstanceOf(InvalidCardStateException.class)
                .extracting("reason").isEqualTo(ExceptionMessage.CARD_ARCHIVED);
        verify(dispatcher, never()).dispatch(any(), any());
    }

    @Test
    @DisplayName("review-now of an unknown card fails with not found")
    void triggerImmediateUnknownCard() {
        UUID id = UUID.randomUUID();
        when(cardStore.getCard(id)).thenThrow(new CardNotFoundException(id));

        assertThatThrownBy(() -> scheduler.triggerImmediate(id)).isInstanceOf(CardNotFoundException.class);
    }

    @Test
    @DisplayName("start runs a first tick right away and stop ends the loop")
    void startAndStop() {
        when(cardStore.listDueCards(5)).thenReturn(List.of());

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        verify(sweeper, timeout(2000)).sweep();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    @DisplayName("auto-start follows the enabled flag")
    void autoStartup() {
        assertThat(scheduler.isAutoStartup()).isTrue();

        properties.getScheduler().setEnabled(false);

        assertThat(new ReviewScheduler(cardStore, dispatcher, sweeper, properties).isAutoStartup()).isFalse();
    }

    private static Card card(CardStatus status) {
        return Card.builder()
                .id(UUID.randomUUID())
                .userId(7)
                .sourceChatId("-100123")
                .sourceMessageIds(List.of(10))
                .contentKind(ContentKind.TEXT)
                .status(status)
                .nextReviewAt(status == CardStatus.PENDING ? null : DUE)
                .build();
    }
}
