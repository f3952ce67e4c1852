package com.project.recall.backend.service;

import java.time.Instant;
import java.util.UUID;

/**
 * What happened to one dispatch attempt.
 *
 * @param messageId  message carrying the grading keyboard ({@code DELIVERED} only).
 * @param copied     whether the full content was copied rather than a reminder sent.
 * @param retryAt    when the card will be tried again ({@code FAILED} only).
 */
public record DeliveryResult(UUID cardId, Outcome outcome, Integer messageId, boolean copied, Instant retryAt) {

    public enum Outcome {
        DELIVERED,
        /** Another path delivered or moved the card first; our message was withdrawn. */
        SUPERSEDED,
        FAILED
    }

    static DeliveryResult delivered(UUID cardId, int messageId, boolean copied) {
        return new DeliveryResult(cardId, Outcome.DELIVERED, messageId, copied, null);
    }

    static DeliveryResult superseded(UUID cardId) {
        return new DeliveryResult(cardId, Outcome.SUPERSEDED, null, false, null);
    }

    static DeliveryResult failed(UUID cardId, Instant retryAt) {
        return new DeliveryResult(cardId, Outcome.FAILED, null, false, retryAt);
    }

    public boolean isDelivered() {
        return outcome == Outcome.DELIVERED;
    }
}
