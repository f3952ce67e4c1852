package com.project.recall.backend.messaging;

import java.util.List;

/**
 * The calls the review core makes into the chat platform.
 *
 * Every method may fail with {@link MessagingException}; a reply whose anchor no longer
 * exists fails with the {@link ReplyTargetMissingException} subtype so callers can fall back
 * without inspecting error text.
 */
public interface MessagingGateway {

    /**
     * Copies the source messages, in order, into the target chat. The grading controls are
     * attached to the last copy.
     *
     * @return ids of the copies, in the same order as {@link SourceRef#messageIds()}.
     */
    List<Integer> copyContent(String targetChatId, SourceRef source, GradingControls controls);

    /**
     * Sends a text message, optionally as a reply, with the grading controls attached.
     */
    SentMessage sendText(String targetChatId, String text, Integer replyToMessageId, GradingControls controls);

    /**
     * Removes the grading controls from a delivered message.
     */
    void clearControls(String chatId, int messageId);

    void deleteMessage(String chatId, int messageId);
}
