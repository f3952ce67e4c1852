package com.project.recall.backend.service;

import com.project.recall.backend.config.ReviewProperties;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardStatus;
import com.project.recall.backend.entity.NotificationReason;
import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.InvalidCardStateException;
import com.project.recall.backend.store.CardStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic loop that finds due cards and hands them to the dispatcher, then lets the
 * sweeper reclaim cards left without a grade.
 *
 * A single Spring task scheduler thread runs the ticks with a fixed delay between them. Ticks never overlap:
 * one that would start while another is still running is skipped.
 */
@Slf4j
@Service
public class ReviewScheduler implements SmartLifecycle {

    private final CardStore cardStore;
    private final NotificationDispatcher dispatcher;
    private final RecoverySweeper sweeper;
    private final ReviewProperties.Scheduler settings;

    private final ReentrantLock tickLock = new ReentrantLock();
    private ThreadPoolTaskScheduler taskScheduler;
    private ScheduledFuture<?> future;
    private volatile boolean running;

    public ReviewScheduler(CardStore cardStore,
                           NotificationDispatcher dispatcher,
                           RecoverySweeper sweeper,
                           ReviewProperties properties) {
        this.cardStore = cardStore;
        this.dispatcher = dispatcher;
        this.sweeper = sweeper;
        this.settings = properties.getScheduler();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("review-scheduler-");
        taskScheduler.setDaemon(true);
        taskScheduler.setWaitForTasksToCompleteOnShutdown(true);
        taskScheduler.setAwaitTerminationMillis(settings.getShutdownTimeout().toMillis());
        taskScheduler.initialize();

        Duration interval = settings.getScanInterval().isZero() || settings.getScanInterval().isNegative()
                ? Duration.ofMillis(1)
                : settings.getScanInterval();
        future = taskScheduler.scheduleWithFixedDelay(this::tick, Instant.now(), interval);
        running = true;
        log.info("Review scheduler started, scanning every {}s for up to {} due card(s)",
                interval.toSeconds(), settings.getBatchSize());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        future.cancel(false);
        // waits up to the shutdown timeout for a tick in progress
        taskScheduler.shutdown();
        log.info("Review scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return settings.isEnabled();
    }

    /**
     * One pass of the loop. Failures of a single card are logged and the batch goes on. The
     * sweep runs even when the due batch could not be loaded.
     */
    public void tick() {
        if (!tickLock.tryLock()) {
            log.debug("Previous tick still running, skipping");
            return;
        }
        try {
            dispatchDueBatch();
            try {
                sweeper.sweep();
            } catch (RuntimeException e) {
                log.error("Recovery sweep failed", e);
            }
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Delivers a card right now, outside the regular schedule.
     *
     * @throws com.project.recall.backend.exception.CardNotFoundException if there is no such card.
     * @throws InvalidCardStateException if the card is still pending or archived.
     */
    public DeliveryResult triggerImmediate(UUID cardId) {
        Card card = cardStore.getCard(cardId);
        if (card.getStatus() == CardStatus.PENDING) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_NOT_ACTIVATED);
        }
        if (card.getStatus() == CardStatus.ARCHIVED) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_ARCHIVED);
        }

        card = releasePendingMessage(card);
        if (card.getStatus() == CardStatus.ARCHIVED) {
            throw new InvalidCardStateException(cardId, ExceptionMessage.CARD_ARCHIVED);
        }
        log.info("Immediate review requested for card {}", cardId);
        return dispatcher.dispatch(card, NotificationReason.MANUAL_NOW);
    }

    private void dispatchDueBatch() {
        List<Card> due;
        try {
            due = cardStore.listDueCards(settings.getBatchSize());
        } catch (RuntimeException e) {
            log.error("Could not load due cards", e);
            return;
        }
        if (!due.isEmpty()) {
            log.info("Dispatching {} due card(s)", due.size());
        }
        for (Card card : due) {
            try {
                dispatchDue(card);
            } catch (RuntimeException e) {
                log.error("Failed to process due card {}", card.getId(), e);
            }
        }
    }

    private void dispatchDue(Card card) {
        Card current = releasePendingMessage(card);
        if (current.getStatus() != CardStatus.LEARNING) {
            log.debug("Card {} left learning before dispatch, skipping", card.getId());
            return;
        }
        dispatcher.dispatch(current, NotificationReason.SCHEDULED);
    }

    /**
     * Drops the keyboard of a message still attached to the card and returns a fresh snapshot
     * that can be dispatched again.
     */
    private Card releasePendingMessage(Card card) {
        if (card.getStatus() != CardStatus.AWAITING_GRADE && !card.hasPendingMessage()) {
            return card;
        }
        dispatcher.clearControlsQuietly(card);
        if (cardStore.clearAwaitingGrade(card.getId())) {
            log.debug("Released the previous delivery of card {}", card.getId());
        }
        return cardStore.getCard(card.getId());
    }
}
