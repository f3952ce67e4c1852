package com.project.recall.backend.config;

import com.project.recall.backend.messaging.MessagingGateway;
import com.project.recall.backend.messaging.telegram.ReviewBotSender;
import com.project.recall.backend.messaging.telegram.TelegramMessagingGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.bots.DefaultBotOptions;

@Configuration
public class TelegramConfiguration {

    @Bean
    public ReviewBotSender reviewBotSender(ReviewProperties properties) {
        String token = properties.getTelegram().getBotToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("review.telegram.bot-token is not set");
        }
        return new ReviewBotSender(new DefaultBotOptions(), token);
    }

    @Bean
    public MessagingGateway messagingGateway(ReviewBotSender reviewBotSender) {
        return new TelegramMessagingGateway(reviewBotSender);
    }
}
