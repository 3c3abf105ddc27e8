package com.example.chat.messaging.dto;

import com.example.chat.shared.model.ConversationSettings;
import com.example.chat.shared.model.LastMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * A conversation as seen by one participant: {@code unreadCount}, {@code muted} and
 * {@code blocked} are that participant's own values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {
    private Long id;
    private String peerId;
    private boolean active;
    private long messageSequence;
    private LastMessage lastMessage;
    private ConversationSettings settings;
    private int unreadCount;
    private boolean muted;
    private boolean blocked;
    private List<ParticipantView> participants;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ParticipantView {
        private String userId;
        private OffsetDateTime joinedAt;
        private OffsetDateTime leftAt;
        private OffsetDateTime lastSeen;
        private boolean typing;
    }
}
