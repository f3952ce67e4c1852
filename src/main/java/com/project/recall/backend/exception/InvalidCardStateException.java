package com.project.recall.backend.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The requested operation is not allowed in the card's current status. Nothing was changed.
 */
@Getter
public class InvalidCardStateException extends RuntimeException {
    private final UUID cardId;
    private final ExceptionMessage reason;

    public InvalidCardStateException(UUID cardId, ExceptionMessage reason) {
        super(reason + ": " + cardId);
        this.cardId = cardId;
        this.reason = reason;
    }
}
