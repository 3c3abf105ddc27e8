package com.example.chat.messaging.store;

import com.example.chat.shared.model.Message;

import java.util.List;

public record ReactionChange(Message message, String userId, String emoji, boolean added,
                             boolean changed, List<String> notifyUserIds) {
}
