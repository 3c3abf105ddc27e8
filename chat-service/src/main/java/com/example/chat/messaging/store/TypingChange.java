package com.example.chat.messaging.store;

import java.util.List;

/**
 * A participant's typing flag together with the users who should hear about it.
 */
public record TypingChange(Long conversationId, String userId, boolean typing, boolean persisted,
                           List<String> recipients) {
}
