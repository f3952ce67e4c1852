package com.project.recall.backend.messaging.telegram;

import com.project.recall.backend.messaging.GradingControls;
import com.project.recall.backend.messaging.MessagingException;
import com.project.recall.backend.messaging.MessagingGateway;
import com.project.recall.backend.messaging.ReplyTargetMissingException;
import com.project.recall.backend.messaging.SentMessage;
import com.project.recall.backend.messaging.SourceRef;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.meta.api.methods.CopyMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageReplyMarkup;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.MessageId;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link MessagingGateway} over the Telegram Bot API.
 *
 * Telegram reports a vanished reply anchor only through the error description, so that text
 * is matched here, once, and turned into {@link ReplyTargetMissingException}.
 */
@Slf4j
public class TelegramMessagingGateway implements MessagingGateway {

    private static final Pattern MISSING_REPLY_TARGET = Pattern.compile(
            "reply message not found|message to reply not found|replied message not found|message to be replied not found",
            Pattern.CASE_INSENSITIVE);

    private final DefaultAbsSender sender;

    public TelegramMessagingGateway(DefaultAbsSender sender) {
        this.sender = sender;
    }

    @Override
    public List<Integer> copyContent(String targetChatId, SourceRef source, GradingControls controls) {
        List<Integer> copies = new ArrayList<>();
        List<Integer> messageIds = source.messageIds();
        for (int i = 0; i < messageIds.size(); i++) {
            boolean last = i == messageIds.size() - 1;
            CopyMessage copy = CopyMessage.builder()
                    .chatId(targetChatId)
                    .fromChatId(source.chatId())
                    .messageId(messageIds.get(i))
                    .replyMarkup(last ? GradingKeyboards.build(controls) : null)
                    .build();
            try {
                MessageId copied = sender.execute(copy);
                copies.add(copied.getMessageId().intValue());
            } catch (TelegramApiException e) {
                discardPartialCopies(targetChatId, copies);
                throw translate("copy message " + messageIds.get(i) + " from " + source.chatId(), e);
            }
        }
        return copies;
    }

    // a half-copied media group has no keyboard and would be copied again on retry
    private void discardPartialCopies(String chatId, List<Integer> copies) {
        for (Integer messageId : copies) {
            try {
                sender.execute(DeleteMessage.builder().chatId(chatId).messageId(messageId).build());
            } catch (TelegramApiException e) {
                log.warn("Could not delete partial copy {} in {}: {}", messageId, chatId, describe(e));
            }
        }
    }

    @Override
    public SentMessage sendText(String targetChatId, String text, Integer replyToMessageId, GradingControls controls) {
        SendMessage message = SendMessage.builder()
                .chatId(targetChatId)
                .text(text)
                .replyToMessageId(replyToMessageId)
                .allowSendingWithoutReply(false)
                .replyMarkup(controls == null ? null : GradingKeyboards.build(controls))
                .build();
        try {
            Message sent = sender.execute(message);
            Integer repliedTo = sent.getReplyToMessage() == null ? null : sent.getReplyToMessage().getMessageId();
            return new SentMessage(targetChatId, sent.getMessageId(), repliedTo);
        } catch (TelegramApiException e) {
            throw translate("send message to " + targetChatId, e);
        }
    }

    @Override
    public void clearControls(String chatId, int messageId) {
        EditMessageReplyMarkup edit = EditMessageReplyMarkup.builder()
                .chatId(chatId)
                .messageId(messageId)
                .replyMarkup(null)
                .build();
        try {
            sender.execute(edit);
        } catch (TelegramApiException e) {
            throw translate("clear keyboard of message " + messageId + " in " + chatId, e);
        }
    }

    @Override
    public void deleteMessage(String chatId, int messageId) {
        try {
            sender.execute(DeleteMessage.builder().chatId(chatId).messageId(messageId).build());
        } catch (TelegramApiException e) {
            throw translate("delete message " + messageId + " in " + chatId, e);
        }
    }

    private MessagingException translate(String action, TelegramApiException e) {
        String description = describe(e);
        if (MISSING_REPLY_TARGET.matcher(description).find()) {
            return new ReplyTargetMissingException("Reply target missing while trying to " + action, e);
        }
        log.debug("Telegram call failed ({}): {}", action, description);
        return new MessagingException("Failed to " + action + ": " + description, e);
    }

    private static String describe(TelegramApiException e) {
        if (e instanceof TelegramApiRequestException) {
            String apiResponse = ((TelegramApiRequestException) e).getApiResponse();
            if (apiResponse != null) {
                return apiResponse;
            }
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
