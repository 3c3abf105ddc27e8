package com.example.chat.messaging.dto;

import com.example.chat.shared.model.MediaAttachment;
import com.example.chat.shared.util.Constants;
import com.example.chat.shared.util.Constants.MessageType;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * New message content. Voice messages are created through the speech upload endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {
    @Builder.Default
    private MessageType type = MessageType.TEXT;

    @Size(max = Constants.MAX_TEXT_LENGTH, message = "Message text must be at most 10000 characters")
    private String text;

    private String language;
    private Long replyToId;
    private Long forwardFromMessageId;
    private MediaAttachment media;
    private OffsetDateTime expiresAt;
}
