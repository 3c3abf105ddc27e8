package com.example.chat.messaging.store;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Outcome of a read acknowledgement. {@code newlyRead} is empty when every message was
 * already read, which makes repeated calls harmless.
 */
public record MarkReadResult(Long conversationId, String readerId, List<Long> newlyRead,
                             List<String> notifyUserIds, OffsetDateTime readAt) {
}
