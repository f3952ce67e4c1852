package com.project.recall.backend.messaging;

/**
 * The message a reply was anchored to does not exist any more (usually deleted by the user).
 */
public class ReplyTargetMissingException extends MessagingException {
    public ReplyTargetMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
