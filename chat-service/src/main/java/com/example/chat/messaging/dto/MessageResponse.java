package com.example.chat.messaging.dto;

import com.example.chat.shared.model.EditRecord;
import com.example.chat.shared.model.ForwardInfo;
import com.example.chat.shared.model.MediaAttachment;
import com.example.chat.shared.util.Constants.MessageStatus;
import com.example.chat.shared.util.Constants.MessageType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageResponse {
    private Long id;
    private Long conversationId;
    private String senderId;
    private long seq;
    private MessageType type;
    private MessageStatus status;
    private String text;
    private String originalLanguage;
    private Map<String, TranslationView> translations;
    private Long replyToId;
    private VoiceView voice;
    private MediaAttachment media;
    private ForwardInfo forwarded;
    private List<ReactionView> reactions;
    private List<ReadReceiptView> readBy;
    private boolean edited;
    private List<EditRecord> editHistory;
    private OffsetDateTime expiresAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TranslationView {
        private String text;
        private double confidence;
        private OffsetDateTime translatedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReactionView {
        private String userId;
        private String emoji;
        private OffsetDateTime reactedAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReadReceiptView {
        private String userId;
        private OffsetDateTime readAt;
    }
}
