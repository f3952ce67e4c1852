package com.project.recall.backend.repository;

import com.project.recall.backend.algorithm.Grade;
import com.project.recall.backend.entity.Card;
import com.project.recall.backend.entity.CardStatus;
import com.project.recall.backend.entity.NotificationReason;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Every state transition below is a single conditional UPDATE keyed by id and current
 * status. The returned row count tells the caller whether the transition applied; 0 means the
 * card was not in the expected state (already moved by a concurrent tick, trigger or grade).
 */
@Repository
public interface CardRepository extends JpaRepository<Card, UUID> {

    @Query("""
        SELECT c FROM Card c
        WHERE c.status = :status
          AND c.nextReviewAt IS NOT NULL
          AND c.nextReviewAt <= :now
        ORDER BY c.nextReviewAt ASC
        """)
    List<Card> findDue(@Param("status") CardStatus status, @Param("now") Instant now, Pageable pageable);

    @Query("""
        SELECT c FROM Card c
        WHERE c.status = :status
          AND c.awaitingGradeSince IS NOT NULL
          AND c.awaitingGradeSince <= :cutoff
        ORDER BY c.awaitingGradeSince ASC
        """)
    List<Card> findAwaitingSince(@Param("status") CardStatus status, @Param("cutoff") Instant cutoff);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :learning,
            c.nextReviewAt = :nextReviewAt,
            c.updatedAt = :now
        WHERE c.id = :id AND c.status = :pending
        """)
    int activate(@Param("id") UUID id,
                 @Param("nextReviewAt") Instant nextReviewAt,
                 @Param("now") Instant now,
                 @Param("pending") CardStatus pending,
                 @Param("learning") CardStatus learning);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :awaiting,
            c.pendingChannelId = :channelId,
            c.pendingChannelMessageId = :messageId,
            c.awaitingGradeSince = :since,
            c.updatedAt = :since
        WHERE c.id = :id
          AND c.status = :learning
          AND c.pendingChannelMessageId IS NULL
        """)
    int markAwaitingGrade(@Param("id") UUID id,
                          @Param("channelId") String channelId,
                          @Param("messageId") Integer messageId,
                          @Param("since") Instant since,
                          @Param("learning") CardStatus learning,
                          @Param("awaiting") CardStatus awaiting);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :learning,
            c.pendingChannelId = NULL,
            c.pendingChannelMessageId = NULL,
            c.awaitingGradeSince = NULL,
            c.updatedAt = :now
        WHERE c.id = :id
          AND (c.status = :awaiting
               OR (c.status = :learning AND c.pendingChannelMessageId IS NOT NULL))
        """)
    int clearAwaitingGrade(@Param("id") UUID id,
                           @Param("now") Instant now,
                           @Param("awaiting") CardStatus awaiting,
                           @Param("learning") CardStatus learning);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :learning,
            c.lastReviewedAt = :reviewedAt,
            c.lastGrade = :grade,
            c.repetition = :repetition,
            c.intervalDays = :intervalDays,
            c.easiness = :easiness,
            c.nextReviewAt = :nextReviewAt,
            c.pendingChannelId = NULL,
            c.pendingChannelMessageId = NULL,
            c.awaitingGradeSince = NULL,
            c.updatedAt = :reviewedAt
        WHERE c.id = :id AND c.status = :awaiting
        """)
    int saveReviewResult(@Param("id") UUID id,
                         @Param("grade") Grade grade,
                         @Param("repetition") int repetition,
                         @Param("intervalDays") int intervalDays,
                         @Param("easiness") double easiness,
                         @Param("reviewedAt") Instant reviewedAt,
                         @Param("nextReviewAt") Instant nextReviewAt,
                         @Param("awaiting") CardStatus awaiting,
                         @Param("learning") CardStatus learning);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Card c SET c.baseChannelMessageId = :messageId WHERE c.id = :id")
    int setBaseMessage(@Param("id") UUID id, @Param("messageId") Integer messageId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.nextReviewAt = :nextReviewAt,
            c.updatedAt = :now
        WHERE c.id = :id AND c.status IN :statuses
        """)
    int updateNextReview(@Param("id") UUID id,
                         @Param("nextReviewAt") Instant nextReviewAt,
                         @Param("now") Instant now,
                         @Param("statuses") Collection<CardStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.lastNotificationAt = :sentAt,
            c.lastNotificationReason = :reason,
            c.lastNotificationMessageId = :messageId
        WHERE c.id = :id
        """)
    int recordNotification(@Param("id") UUID id,
                           @Param("messageId") Integer messageId,
                           @Param("reason") NotificationReason reason,
                           @Param("sentAt") Instant sentAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :archived,
            c.pendingChannelId = NULL,
            c.pendingChannelMessageId = NULL,
            c.awaitingGradeSince = NULL,
            c.updatedAt = :now
        WHERE c.id = :id AND c.status IN :from
        """)
    int archive(@Param("id") UUID id,
                @Param("now") Instant now,
                @Param("from") Collection<CardStatus> from,
                @Param("archived") CardStatus archived);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :learning,
            c.nextReviewAt = COALESCE(c.nextReviewAt, :now),
            c.updatedAt = :now
        WHERE c.id = :id AND c.status = :archived
        """)
    int restore(@Param("id") UUID id,
                @Param("now") Instant now,
                @Param("archived") CardStatus archived,
                @Param("learning") CardStatus learning);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :learning,
            c.nextReviewAt = :nextReviewAt,
            c.pendingChannelId = NULL,
            c.pendingChannelMessageId = NULL,
            c.awaitingGradeSince = NULL,
            c.updatedAt = :now
        WHERE c.id = :id AND c.status IN :from
        """)
    int moveToLearning(@Param("id") UUID id,
                       @Param("nextReviewAt") Instant nextReviewAt,
                       @Param("now") Instant now,
                       @Param("from") Collection<CardStatus> from,
                       @Param("learning") CardStatus learning);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        UPDATE Card c
        SET c.status = :learning,
            c.intervalDays = :intervalDays,
            c.nextReviewAt = :nextReviewAt,
            c.lastReviewedAt = :now,
            c.pendingChannelId = NULL,
            c.pendingChannelMessageId = NULL,
            c.awaitingGradeSince = NULL,
            c.updatedAt = :now
        WHERE c.id = :id AND c.status = :awaiting
        """)
    int applyInterval(@Param("id") UUID id,
                      @Param("intervalDays") int intervalDays,
                      @Param("nextReviewAt") Instant nextReviewAt,
                      @Param("now") Instant now,
                      @Param("awaiting") CardStatus awaiting,
                      @Param("learning") CardStatus learning);
}
