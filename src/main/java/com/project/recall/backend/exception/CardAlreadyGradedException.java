package com.project.recall.backend.exception;

import java.util.UUID;

/**
 * A grade arrived for a card whose review was completed in the meantime (double tap, or
 * the sweeper reclaimed it first).
 */
public class CardAlreadyGradedException extends InvalidCardStateException {
    public CardAlreadyGradedException(UUID cardId) {
        super(cardId, ExceptionMessage.CARD_ALREADY_GRADED);
    }
}
