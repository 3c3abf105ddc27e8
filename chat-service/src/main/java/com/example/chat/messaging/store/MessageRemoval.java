package com.example.chat.messaging.store;

import java.util.List;

public record MessageRemoval(Long messageId, Long conversationId, List<String> notifyUserIds) {
}
