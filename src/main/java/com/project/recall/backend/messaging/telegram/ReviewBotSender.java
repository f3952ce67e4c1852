package com.project.recall.backend.messaging.telegram;

import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;

/**
 * Outbound-only Telegram client. Updates (button presses) are received by the bot layer,
 * which is not part of this service.
 */
public class ReviewBotSender extends DefaultAbsSender {

    public ReviewBotSender(DefaultBotOptions options, String botToken) {
        super(options, botToken);
    }
}
