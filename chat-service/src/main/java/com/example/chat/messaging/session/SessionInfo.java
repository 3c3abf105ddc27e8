package com.example.chat.messaging.session;

import java.time.Instant;

public record SessionInfo(String userId, String sessionId, Instant connectedAt, Instant lastActivity) {
}
