package com.example.chat.messaging.store;

import com.example.chat.shared.model.MediaAttachment;
import com.example.chat.shared.model.VoiceNote;
import com.example.chat.shared.util.Constants.MessageType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.OffsetDateTime;

/**
 * Client-supplied content of a new message. Everything that orders or identifies the
 * message (sequence, timestamps, status) is assigned by the store.
 */
@Value
@Builder
@With
public class SendMessageCommand {
    @Builder.Default
    MessageType type = MessageType.TEXT;
    String text;
    String language;
    Long replyToId;
    Long forwardFromMessageId;
    VoiceNote voice;
    MediaAttachment media;
    OffsetDateTime expiresAt;
}
