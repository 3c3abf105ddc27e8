package com.example.chat.messaging.presence;

import com.example.chat.shared.util.Constants.PresenceStatus;

import java.time.OffsetDateTime;

public record FriendStatusPayload(String userId, PresenceStatus status, OffsetDateTime lastActive) {
}
