package com.example.chat.messaging.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Data parts of the outbound real-time events about messages and conversations.
 */
public final class EventPayloads {

    private EventPayloads() {}

    public record NewMessage(Long conversationId, MessageResponse message) {
    }

    public record MessageEdited(Long messageId, Long conversationId, String newContent, OffsetDateTime editedAt) {
    }

    public record MessageRemoved(Long messageId, Long conversationId) {
    }

    public record Reaction(String userId, String emoji) {
    }

    public record MessageReaction(Long messageId, Long conversationId, Reaction reaction, String action) {
    }

    public record MessagesRead(Long conversationId, String readerId, List<Long> messageIds, OffsetDateTime readAt) {
    }

    public record ConversationMembership(Long conversationId, String userId) {
    }

    public record SignalFailed(String targetUserId, String event, String reason) {
    }

    public record Pong(OffsetDateTime timestamp) {
    }
}
