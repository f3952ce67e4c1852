package com.project.recall.backend.exception;

import java.util.UUID;

public class CardNotFoundException extends RuntimeException {
    public CardNotFoundException(UUID cardId) {
        super(ExceptionMessage.CARD_NOT_FOUND + ": " + cardId);
    }
}
