package com.example.chat.messaging.service;

import com.example.chat.messaging.dto.ConversationResponse;
import com.example.chat.messaging.dto.EventPayloads;
import com.example.chat.messaging.dto.MessageResponse;
import com.example.chat.messaging.dto.PageResponse;
import com.example.chat.messaging.event.ChatEventPublisher;
import com.example.chat.messaging.event.FanoutResult;
import com.example.chat.messaging.mapper.ChatMapper;
import com.example.chat.messaging.ratelimit.ChatRateLimiter;
import com.example.chat.messaging.ratelimit.ChatRateLimiter.Limit;
import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.store.MarkReadResult;
import com.example.chat.messaging.store.MessageRemoval;
import com.example.chat.messaging.store.MessageStore;
import com.example.chat.messaging.store.PageResult;
import com.example.chat.messaging.store.ReactionChange;
import com.example.chat.messaging.store.SendMessageCommand;
import com.example.chat.messaging.store.SettingsUpdate;
import com.example.chat.messaging.translation.TranslationCache;
import com.example.chat.messaging.translation.TranslationResult;
import com.example.chat.messaging.typing.TypingCoordinator;
import com.example.chat.messaging.voice.VoiceIngestResult;
import com.example.chat.messaging.voice.VoicePipeline;
import com.example.chat.shared.model.Conversation;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.util.Constants.ChatEventType;
import com.example.chat.shared.util.Constants.MessageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Reactive entry point used by the HTTP controllers and the connection gateway. Store calls
 * run on the JDBC scheduler; every durable change is followed by a best-effort fan-out to
 * the other participants.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatService {

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final TranslationCache translationCache;
    private final VoicePipeline voicePipeline;
    private final TypingCoordinator typingCoordinator;
    private final ChatEventPublisher eventPublisher;
    private final ChatRateLimiter rateLimiter;
    private final ChatMapper chatMapper;
    private final Scheduler jdbcScheduler;

    public Mono<PageResponse<ConversationResponse>> listConversations(String userId, Integer page, Integer limit) {
        return blocking(() -> chatMapper.toConversationPage(conversationStore.listConversations(userId, page, limit), userId));
    }

    public Mono<ConversationResponse> getOrCreateConversation(String userId, String peerId) {
        return blocking(() -> chatMapper.toConversationResponse(conversationStore.getOrCreateConversation(userId, peerId), userId));
    }

    /**
     * Returns a page of messages and marks the ones the caller received as read.
     */
    public Mono<PageResponse<MessageResponse>> listMessages(Long conversationId, String userId, Integer page, Integer limit) {
        return blocking(() -> {
            PageResult<Message> result = messageStore.listMessages(conversationId, userId, page, limit);
            List<Long> ids = result.items().stream().map(Message::getId).toList();
            MarkReadResult read = messageStore.markRead(conversationId, userId, ids);
            announceRead(read);
            if (!read.newlyRead().isEmpty()) {
                // reflect the receipts just written without reloading the page
                result.items().stream()
                        .filter(m -> read.newlyRead().contains(m.getId()))
                        .forEach(m -> m.setStatus(MessageStatus.READ));
            }
            return chatMapper.toMessagePage(result);
        });
    }

    public Mono<MessageResponse> sendMessage(Long conversationId, String userId, SendMessageCommand command) {
        return blocking(() -> {
            rateLimiter.acquire(Limit.SEND, userId);
            Message message = messageStore.sendMessage(conversationId, userId, command);
            return chatMapper.toMessageResponse(deliver(message, userId));
        });
    }

    public Mono<VoiceIngestResult> sendVoiceMessage(Long conversationId, String userId, byte[] audio, String mimeType,
                                                   String languageHint) {
        return blocking(() -> {
                    rateLimiter.acquire(Limit.SPEECH, userId);
                    return true;
                })
                .then(voicePipeline.ingestVoice(conversationId, userId, audio, mimeType, languageHint))
                .publishOn(jdbcScheduler)
                .map(result -> new VoiceIngestResult(deliver(result.message(), userId), result.fallback()));
    }

    public Mono<MarkReadResult> markRead(Long conversationId, String userId, List<Long> messageIds) {
        return blocking(() -> {
            MarkReadResult result = messageStore.markRead(conversationId, userId, messageIds);
            announceRead(result);
            return result;
        });
    }

    public Mono<ConversationResponse> updateSettings(Long conversationId, String userId, SettingsUpdate update) {
        return blocking(() -> chatMapper.toConversationResponse(conversationStore.updateSettings(conversationId, userId, update), userId));
    }

    public Mono<FanoutResult> setTyping(Long conversationId, String userId, boolean typing) {
        return blocking(() -> {
            if (typing) {
                rateLimiter.acquire(Limit.TYPING, userId);
            }
            return typingCoordinator.setTyping(conversationId, userId, typing);
        });
    }

    public Mono<ConversationResponse> leaveConversation(Long conversationId, String userId) {
        return blocking(() -> {
            Conversation conversation = conversationStore.leaveConversation(conversationId, userId);
            eventPublisher.fanOut(conversation.otherActiveParticipantIds(userId), ChatEventType.CONVERSATION_LEFT,
                    new EventPayloads.ConversationMembership(conversationId, userId));
            return chatMapper.toConversationResponse(conversation, userId);
        });
    }

    public Mono<MessageResponse> editMessage(Long messageId, String userId, String newText) {
        return blocking(() -> {
            Message message = messageStore.editMessage(messageId, userId, newText);
            translationCache.invalidate(messageId);
            Conversation conversation = conversationStore.getForParticipant(message.getConversationId(), userId);
            eventPublisher.fanOut(conversation.otherActiveParticipantIds(userId), ChatEventType.MESSAGE_EDITED,
                    new EventPayloads.MessageEdited(messageId, message.getConversationId(), message.getOriginalText(),
                            message.getUpdatedAt()));
            return chatMapper.toMessageResponse(message);
        });
    }

    public Mono<MessageRemoval> removeMessage(Long messageId, String userId) {
        return blocking(() -> {
            MessageRemoval removal = messageStore.removeMessage(messageId, userId);
            eventPublisher.fanOut(removal.notifyUserIds(), ChatEventType.MESSAGE_REMOVED,
                    new EventPayloads.MessageRemoved(messageId, removal.conversationId()));
            return removal;
        });
    }

    public Mono<MessageResponse> setReaction(Long messageId, String userId, String emoji) {
        return blocking(() -> {
            rateLimiter.acquire(Limit.REACTION, userId);
            ReactionChange change = messageStore.setReaction(messageId, userId, emoji);
            announceReaction(change);
            return chatMapper.toMessageResponse(change.message());
        });
    }

    public Mono<MessageResponse> clearReaction(Long messageId, String userId, String emoji) {
        return blocking(() -> {
            ReactionChange change = messageStore.clearReaction(messageId, userId, emoji);
            announceReaction(change);
            return chatMapper.toMessageResponse(change.message());
        });
    }

    public Mono<PageResponse<MessageResponse>> search(String userId, String query, Long conversationId, Integer page, Integer limit) {
        return blocking(() -> chatMapper.toMessagePage(messageStore.searchMessages(userId, query, conversationId, page, limit)));
    }

    public Mono<TranslationResult> translateMessage(Long messageId, String userId, String targetLanguage) {
        return blocking(() -> {
                    rateLimiter.acquire(Limit.TRANSLATE, userId);
                    return messageStore.getForParticipant(messageId, userId);
                })
                .flatMap(message -> translationCache.getOrTranslate(message, targetLanguage));
    }

    /**
     * Pushes a removal to the participants of a message that expired.
     */
    public FanoutResult announceRemoval(MessageRemoval removal) {
        return eventPublisher.fanOut(removal.notifyUserIds(), ChatEventType.MESSAGE_REMOVED,
                new EventPayloads.MessageRemoved(removal.messageId(), removal.conversationId()));
    }

    private Message deliver(Message message, String senderId) {
        Conversation conversation = conversationStore.getForParticipant(message.getConversationId(), senderId);
        MessageResponse payload = chatMapper.toMessageResponse(message);
        FanoutResult result = eventPublisher.fanOut(conversation.otherActiveParticipantIds(senderId),
                ChatEventType.NEW_MESSAGE, new EventPayloads.NewMessage(message.getConversationId(), payload));
        if (result.delivered() > 0 && messageStore.markDelivered(message.getId())) {
            message.setStatus(MessageStatus.DELIVERED);
        }
        return message;
    }

    private void announceRead(MarkReadResult result) {
        if (result.newlyRead().isEmpty()) {
            return;
        }
        eventPublisher.fanOut(result.notifyUserIds(), ChatEventType.MESSAGES_READ,
                new EventPayloads.MessagesRead(result.conversationId(), result.readerId(), result.newlyRead(), result.readAt()));
    }

    private void announceReaction(ReactionChange change) {
        if (!change.changed()) {
            return;
        }
        Message message = change.message();
        eventPublisher.fanOut(change.notifyUserIds(), ChatEventType.MESSAGE_REACTION,
                new EventPayloads.MessageReaction(message.getId(), message.getConversationId(),
                        new EventPayloads.Reaction(change.userId(), change.emoji()),
                        change.added() ? "add" : "remove"));
    }

    private <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(jdbcScheduler);
    }
}
