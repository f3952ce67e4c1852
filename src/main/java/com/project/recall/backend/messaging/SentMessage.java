package com.project.recall.backend.messaging;

/**
 * A message the gateway sent.
 *
 * @param replyToMessageId the message it actually replies to, or {@code null} when the
 *                         platform delivered it without a reply anchor.
 */
public record SentMessage(String chatId, int messageId, Integer replyToMessageId) {

    public boolean isReply() {
        return replyToMessageId != null;
    }
}
