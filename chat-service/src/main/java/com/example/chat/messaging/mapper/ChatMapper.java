package com.example.chat.messaging.mapper;

import com.example.chat.messaging.dto.ConversationResponse;
import com.example.chat.messaging.dto.MessageResponse;
import com.example.chat.messaging.dto.PageResponse;
import com.example.chat.messaging.dto.VoiceView;
import com.example.chat.messaging.store.PageResult;
import com.example.chat.shared.model.Conversation;
import com.example.chat.shared.model.ConversationParticipant;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.model.MessageReaction;
import com.example.chat.shared.model.MessageTranslation;
import com.example.chat.shared.model.ReadReceipt;
import com.example.chat.shared.model.VoiceNote;
import org.mapstruct.AfterMapping;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Mapper(componentModel = "spring")
public abstract class ChatMapper {

    @Mapping(source = "originalText", target = "text")
    @Mapping(target = "reactions", expression = "java(reactionViews(message.getReactions()))")
    @Mapping(target = "readBy", expression = "java(readReceiptViews(message.getReadBy()))")
    public abstract MessageResponse toMessageResponse(Message message);

    public abstract List<MessageResponse> toMessageResponses(List<Message> messages);

    @Mapping(target = "waveform", expression = "java(com.example.chat.shared.util.JsonUtils.parseAmplitudes(voice.getWaveform()))")
    public abstract VoiceView toVoiceView(VoiceNote voice);

    public abstract MessageResponse.TranslationView toTranslationView(MessageTranslation translation);

    // Viewer-specific fields are filled in @AfterMapping
    @Mapping(target = "peerId", ignore = true)
    @Mapping(target = "unreadCount", ignore = true)
    @Mapping(target = "muted", ignore = true)
    @Mapping(target = "blocked", ignore = true)
    public abstract ConversationResponse toConversationResponse(Conversation conversation, @Context String viewerId);

    public abstract ConversationResponse.ParticipantView toParticipantView(ConversationParticipant participant);

    @AfterMapping
    protected void fillViewerFields(@MappingTarget ConversationResponse.ConversationResponseBuilder builder,
                                    Conversation conversation, @Context String viewerId) {
        builder.peerId(conversation.peerOf(viewerId).orElse(null));
        conversation.participant(viewerId).ifPresent(self -> builder
                .unreadCount(self.getUnreadCount())
                .muted(self.isMuted())
                .blocked(self.isBlocked()));
    }

    public PageResponse<MessageResponse> toMessagePage(PageResult<Message> page) {
        return toPage(page, this::toMessageResponse);
    }

    public PageResponse<ConversationResponse> toConversationPage(PageResult<Conversation> page, String viewerId) {
        return toPage(page, conversation -> toConversationResponse(conversation, viewerId));
    }

    protected List<MessageResponse.ReactionView> reactionViews(Map<String, MessageReaction> reactions) {
        if (reactions == null) {
            return List.of();
        }
        return reactions.entrySet().stream()
                .map(e -> new MessageResponse.ReactionView(e.getKey(), e.getValue().getEmoji(), e.getValue().getReactedAt()))
                .sorted(Comparator.comparing(MessageResponse.ReactionView::getReactedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    protected List<MessageResponse.ReadReceiptView> readReceiptViews(Map<String, ReadReceipt> readBy) {
        if (readBy == null) {
            return List.of();
        }
        return readBy.entrySet().stream()
                .map(e -> new MessageResponse.ReadReceiptView(e.getKey(), e.getValue().getReadAt()))
                .toList();
    }

    private static <S, T> PageResponse<T> toPage(PageResult<S> page, Function<S, T> mapper) {
        return new PageResponse<>(page.items().stream().map(mapper).toList(), page.page(), page.limit(),
                page.total(), page.hasMore());
    }
}
