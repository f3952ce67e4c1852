package com.project.recall.backend.entity;

import com.project.recall.backend.algorithm.ReminderMode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the card enums under the lowercase values the bot has always written to the
 * {@code cards} table instead of their Java names.
 */
public final class EnumValueConverters {

    private EnumValueConverters() {
    }

    @Converter
    public static class CardStatusConverter implements AttributeConverter<CardStatus, String> {
        @Override
        public String convertToDatabaseColumn(CardStatus attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public CardStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : CardStatus.fromValue(dbData);
        }
    }

    @Converter
    public static class ReminderModeConverter implements AttributeConverter<ReminderMode, String> {
        @Override
        public String convertToDatabaseColumn(ReminderMode attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public ReminderMode convertToEntityAttribute(String dbData) {
            return dbData == null ? null : ReminderMode.fromValue(dbData);
        }
    }

    @Converter
    public static class NotificationReasonConverter implements AttributeConverter<NotificationReason, String> {
        @Override
        public String convertToDatabaseColumn(NotificationReason attribute) {
            return attribute == null ? null : attribute.getValue();
        }

        @Override
        public NotificationReason convertToEntityAttribute(String dbData) {
            return dbData == null ? null : NotificationReason.fromValue(dbData);
        }
    }
}
