package com.project.recall.backend.exception;

public enum ExceptionMessage {

    USER_DOES_NOT_EXIST("User does not exist"),
    VALIDATION_FAILED("Validation has failed"),
    CARD_NOT_FOUND("Card does not exist"),
    CARD_NOT_ACTIVATED("Card has not been activated yet"),
    CARD_NOT_PENDING("Card has already been processed"),
    CARD_NOT_AWAITING_GRADE("Card is not waiting for a grade"),
    CARD_ALREADY_GRADED("Card review has already been processed"),
    CARD_ARCHIVED("Card is archived"),
    CARD_NOT_ARCHIVED("Card is not archived"),
    NEXT_REVIEW_IN_PAST("Next review must be in the future"),
    NO_DELIVERY_TARGET("No chat to deliver the card to"),
    ;

    final private String message;
    ExceptionMessage(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
