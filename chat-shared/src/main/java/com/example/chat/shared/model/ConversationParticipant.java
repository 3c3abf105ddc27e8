package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * One side of a conversation together with that user's private status record.
 * Identity inside the aggregate is the user id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "userId")
@Table("conversation_participants")
public class ConversationParticipant {
    private String userId;
    private OffsetDateTime joinedAt;
    private OffsetDateTime leftAt;
    private OffsetDateTime lastSeen;
    private int unreadCount;
    private boolean typing;
    private OffsetDateTime lastTypingAt;
    private boolean muted;
    private boolean blocked;

    public boolean hasLeft() {
        return leftAt != null;
    }
}
