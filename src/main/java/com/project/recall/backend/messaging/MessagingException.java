package com.project.recall.backend.messaging;

/**
 * A call into the chat platform failed (network, permissions, rate limit...).
 */
public class MessagingException extends RuntimeException {
    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
