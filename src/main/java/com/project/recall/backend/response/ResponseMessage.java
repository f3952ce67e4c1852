package com.project.recall.backend.response;

public enum ResponseMessage {
    LOGIN_SUCCESSFUL("Login successful"),
    LOGOUT_SUCCESSFUL("Logout successful"),
    AUTHENTICATION_FAILED("Authentication Failed"),
    ACCESS_DENIED("Access Denied"),
    SUCCESS("Success"),
    CARD_CREATED("Card created"),
    CARD_DELIVERED("Card delivered"),
    DELIVERY_NOT_COMPLETED("Card could not be delivered right now"),
    CARD_GRADED("Card graded"),
    CARD_DELETED("Card deleted"),
    ;
    private final String message;
    ResponseMessage(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
