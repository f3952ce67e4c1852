package com.project.recall.backend.service;

import com.project.recall.backend.algorithm.IntervalEngine;
import com.project.recall.backend.algorithm.ReviewComputation;
import com.project.recall.backend.config.ReviewProperties;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.store.CardStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Reclaims cards that were delivered but never graded.
 *
 * Every transition here is conditional on the card still awaiting a grade, so running the
 * sweep twice, or racing a late grade, changes nothing the second time.
 */
@Slf4j
@Service
public class RecoverySweeper {

    private final CardStore cardStore;
    private final NotificationDispatcher dispatcher;
    private final IntervalEngine intervalEngine;
    private final ReviewProperties.Sweeper settings;
    private final Clock clock;

    public RecoverySweeper(CardStore cardStore,
                           NotificationDispatcher dispatcher,
                           IntervalEngine intervalEngine,
                           ReviewProperties properties,
                           Clock clock) {
        this.cardStore = cardStore;
        this.dispatcher = dispatcher;
        this.intervalEngine = intervalEngine;
        this.settings = properties.getSweeper();
        this.clock = clock;
    }

    /**
     * @return the number of cards moved back to learning by this run.
     */
    public int sweep() {
        Instant now = Instant.now(clock);
        List<Card> expired = cardStore.listExpiredAwaiting(now.minus(settings.getAwaitingTimeout()));
        if (expired.isEmpty()) {
            return 0;
        }

        int reclaimed = 0;
        for (Card card : expired) {
            try {
                if (reclaim(card, now)) {
                    reclaimed++;
                }
            } catch (RuntimeException e) {
                log.error("Could not reclaim card {} awaiting a grade since {}", card.getId(), card.getAwaitingGradeSince(), e);
            }
        }
        log.info("Sweep reclaimed {} of {} expired card(s)", reclaimed, expired.size());
        return reclaimed;
    }

    private boolean reclaim(Card card, Instant now) {
        dispatcher.clearControlsQuietly(card);

        if (settings.getTimeoutPolicy() == ReviewProperties.TimeoutPolicy.AUTO_GRADE) {
            ReviewComputation result = intervalEngine.computeReview(card.getReminderMode(), card.schedulingState(),
                    settings.getAutoGrade(), now);
            boolean applied = cardStore.saveReviewResult(card.getId(), result);
            if (applied) {
                log.info("Card {} timed out, graded {} and scheduled for {}", card.getId(),
                        result.grade().getKey(), result.nextReviewAt());
            }
            return applied;
        }

        boolean applied = cardStore.clearAwaitingGrade(card.getId());
        if (applied) {
            log.info("Card {} timed out and is due again", card.getId());
        }
        return applied;
    }
}
