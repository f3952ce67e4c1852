package com.project.recall.backend.messaging;

import java.util.List;

/**
 * Where a card's content originally lives: a chat and one or more message ids, in
 * original order (several for a media group).
 */
public record SourceRef(String chatId, List<Integer> messageIds) {

    public SourceRef {
        if (messageIds == null || messageIds.isEmpty()) {
            throw new IllegalArgumentException("Source reference needs at least one message id");
        }
        messageIds = List.copyOf(messageIds);
    }
}
