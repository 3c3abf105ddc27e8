package com.example.chat.shared.model;

import com.example.chat.shared.util.Constants.MessageStatus;
import com.example.chat.shared.util.Constants.MessageType;
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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A chat message. Translations, reactions, read receipts and edit history are part of the
 * aggregate and are rewritten together under the message version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("chat_messages")
public class Message {
    @Id
    private Long id;
    @Version
    private Long version;
    private Long conversationId;
    private String senderId;
    /** Position of the message inside its conversation, assigned by the server. */
    private long seq;

    private String originalText;
    private String originalLanguage;

    private MessageType type;
    private MessageStatus status;
    private Long replyToId;
    private boolean edited;
    private boolean removed;
    private OffsetDateTime removedAt;
    private OffsetDateTime expiresAt;

    @Embedded.Nullable(prefix = "voice_")
    private VoiceNote voice;

    @Embedded.Nullable(prefix = "media_")
    private MediaAttachment media;

    @Embedded.Nullable(prefix = "forwarded_")
    private ForwardInfo forwarded;

    @MappedCollection(idColumn = "message_id", keyColumn = "language")
    @Builder.Default
    private Map<String, MessageTranslation> translations = new HashMap<>();

    @MappedCollection(idColumn = "message_id", keyColumn = "user_id")
    @Builder.Default
    private Map<String, MessageReaction> reactions = new HashMap<>();

    @MappedCollection(idColumn = "message_id", keyColumn = "user_id")
    @Builder.Default
    private Map<String, ReadReceipt> readBy = new HashMap<>();

    @MappedCollection(idColumn = "message_id", keyColumn = "edit_index")
    @Builder.Default
    private List<EditRecord> editHistory = new ArrayList<>();

    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public boolean isReadBy(String userId) {
        return readBy.containsKey(userId);
    }
}
