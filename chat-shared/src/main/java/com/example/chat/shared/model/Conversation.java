package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Embedded;
import org.springframework.data.relational.core.mapping.MappedCollection;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A direct conversation between exactly two users. The aggregate root carries the version
 * used for optimistic locking; participants are saved with it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("conversations")
public class Conversation {
    @Id
    private Long id;
    @Version
    private Long version;
    /** Sorted "a|b" key of the two users. Unique while set; cleared once a participant leaves. */
    private String pairKey;
    private boolean active;
    /** Last sequence number handed to a message of this conversation. */
    private long messageSequence;

    @Embedded.Nullable(prefix = "last_message_")
    private LastMessage lastMessage;

    @Embedded.Empty(prefix = "settings_")
    @Builder.Default
    private ConversationSettings settings = new ConversationSettings();

    @MappedCollection(idColumn = "conversation_id")
    @Builder.Default
    private Set<ConversationParticipant> participants = new HashSet<>();

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static String pairKeyOf(String userA, String userB) {
        return userA.compareTo(userB) <= 0 ? userA + "|" + userB : userB + "|" + userA;
    }

    public Optional<ConversationParticipant> participant(String userId) {
        return participants.stream().filter(p -> p.getUserId().equals(userId)).findFirst();
    }

    public Optional<ConversationParticipant> activeParticipant(String userId) {
        return participant(userId).filter(p -> !p.hasLeft());
    }

    public boolean isActiveParticipant(String userId) {
        return activeParticipant(userId).isPresent();
    }

    public Stream<ConversationParticipant> otherActiveParticipants(String userId) {
        return participants.stream().filter(p -> !p.hasLeft() && !p.getUserId().equals(userId));
    }

    public List<String> otherActiveParticipantIds(String userId) {
        return otherActiveParticipants(userId).map(ConversationParticipant::getUserId).toList();
    }

    public Optional<String> peerOf(String userId) {
        return participants.stream().map(ConversationParticipant::getUserId).filter(id -> !id.equals(userId)).findFirst();
    }
}
