package com.example.chat.messaging.typing;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TypingStatusPayload(Long conversationId, String userId, @JsonProperty("isTyping") boolean typing) {
}
