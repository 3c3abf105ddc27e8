package com.example.chat.messaging.store;

import com.example.chat.messaging.directory.DirectoryService;
import com.example.chat.messaging.translation.Language;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.AuthorizationFailureException;
import com.example.chat.shared.exception.ResourceNotFoundException;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.Conversation;
import com.example.chat.shared.model.ConversationParticipant;
import com.example.chat.shared.model.EditRecord;
import com.example.chat.shared.model.ForwardInfo;
import com.example.chat.shared.model.LastMessage;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.model.MessageReaction;
import com.example.chat.shared.model.MessageTranslation;
import com.example.chat.shared.model.ReadReceipt;
import com.example.chat.shared.repository.ConversationRepository;
import com.example.chat.shared.repository.MessageRepository;
import com.example.chat.shared.service.OptimisticRetryTemplate;
import com.example.chat.shared.util.Constants;
import com.example.chat.shared.util.Constants.MessageStatus;
import com.example.chat.shared.util.Constants.MessageType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.example.chat.messaging.store.ConversationStore.normalizeLimit;
import static com.example.chat.messaging.store.ConversationStore.normalizePage;
import static com.example.chat.messaging.store.ConversationStore.now;
import static com.example.chat.messaging.store.ConversationStore.requireActiveParticipant;

/**
 * Owns the message aggregate. Sending bumps the conversation's sequence and version in the
 * same transaction as the insert, so concurrent senders into one conversation are
 * serialized by the version check and retried in order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("store")
public class MessageStore {

    private static final int MAX_EMOJI_LENGTH = 32;
    private static final int MAX_SEARCH_LENGTH = 200;
    private static final int PREVIEW_LENGTH = 200;

    private final MessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final ConversationStore conversationStore;
    private final DirectoryService directoryService;
    private final OptimisticRetryTemplate retryTemplate;
    private final AppProperties appProperties;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    public Message sendMessage(Long conversationId, String senderId, SendMessageCommand command) {
        if (command == null) {
            throw new ValidationFailureException("Message payload is required");
        }
        Conversation snapshot = conversationStore.load(conversationId);
        requireActiveParticipant(snapshot, senderId);
        rejectBlocked(snapshot, senderId);

        SendMessageCommand resolved = resolveForward(command, senderId);
        validatePayload(resolved);
        if (resolved.getReplyToId() != null) {
            Message target = messageRepository.findById(resolved.getReplyToId())
                    .orElseThrow(() -> new ValidationFailureException("Reply target " + resolved.getReplyToId() + " does not exist"));
            if (!conversationId.equals(target.getConversationId())) {
                throw new ValidationFailureException("Reply target must belong to the same conversation");
            }
        }

        Message saved = retryTemplate.execute("sendMessage", () -> {
            Conversation conversation = conversationStore.load(conversationId);
            ConversationParticipant sender = requireActiveParticipant(conversation, senderId);
            rejectBlocked(conversation, senderId);

            OffsetDateTime createdAt = nextTimestamp(conversation);
            long seq = conversation.getMessageSequence() + 1;

            conversation.setMessageSequence(seq);
            conversation.setLastMessage(LastMessage.builder()
                    .text(preview(resolved))
                    .senderId(senderId)
                    .type(resolved.getType())
                    .timestamp(createdAt)
                    .build());
            conversation.setUpdatedAt(createdAt);
            sender.setLastSeen(createdAt);
            sender.setTyping(false);
            conversation.otherActiveParticipants(senderId)
                    .forEach(p -> p.setUnreadCount(p.getUnreadCount() + 1));
            // the version check on this save is what serializes concurrent senders
            conversationRepository.save(conversation);

            return messageRepository.save(Message.builder()
                    .conversationId(conversationId)
                    .senderId(senderId)
                    .seq(seq)
                    .originalText(resolved.getText() == null ? "" : resolved.getText())
                    .originalLanguage(normalizeLanguage(resolved.getLanguage()))
                    .type(resolved.getType())
                    .status(MessageStatus.SENT)
                    .replyToId(resolved.getReplyToId())
                    .voice(resolved.getVoice())
                    .media(resolved.getMedia())
                    .forwarded(forwardInfo(resolved, command))
                    .expiresAt(resolved.getExpiresAt())
                    .createdAt(createdAt)
                    .updatedAt(createdAt)
                    .build());
        });
        metricsCollector.incrementCounter("chat.messages.sent", "type", saved.getType().getValue());
        log.debug("Message {} (seq {}) stored in conversation {}", saved.getId(), saved.getSeq(), conversationId);
        return saved;
    }

    public Message getForParticipant(Long messageId, String userId) {
        Message message = load(messageId);
        Conversation conversation = conversationStore.load(message.getConversationId());
        requireActiveParticipant(conversation, userId);
        if (message.isRemoved()) {
            throw ResourceNotFoundException.message(messageId);
        }
        return message;
    }

    public Optional<Message> findById(Long messageId) {
        return messageRepository.findById(messageId);
    }

    /**
     * Page of visible messages, newest page first, each page ordered oldest-first for display.
     */
    public PageResult<Message> listMessages(Long conversationId, String userId, Integer page, Integer limit) {
        conversationStore.getForParticipant(conversationId, userId);
        AppProperties.Store store = appProperties.getStore();
        int pageNumber = normalizePage(page);
        int pageSize = normalizeLimit(limit, store.getDefaultMessagePageSize(), store.getMaxMessagePageSize());
        List<Message> newestFirst = messageRepository.findPageNewestFirst(conversationId, pageSize, (long) (pageNumber - 1) * pageSize);
        List<Message> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return new PageResult<>(oldestFirst, pageNumber, pageSize, messageRepository.countVisible(conversationId));
    }

    /**
     * Adds a read receipt for every listed message that {@code userId} did not send and has
     * not read yet, and resets the caller's unread counter. Repeating the call changes nothing
     * but {@code lastSeen}.
     */
    public MarkReadResult markRead(Long conversationId, String userId, Collection<Long> messageIds) {
        List<Long> ids = messageIds == null ? List.of() : List.copyOf(new LinkedHashSet<>(messageIds));
        return retryTemplate.execute("markRead", () -> {
            Conversation conversation = conversationStore.load(conversationId);
            ConversationParticipant reader = requireActiveParticipant(conversation, userId);
            OffsetDateTime now = now();

            List<Long> newlyRead = new ArrayList<>();
            List<String> notify = new ArrayList<>();
            if (!ids.isEmpty()) {
                for (Message message : messageRepository.findByConversationIdAndIdIn(conversationId, ids)) {
                    if (userId.equals(message.getSenderId()) || message.isReadBy(userId)) {
                        continue;
                    }
                    message.getReadBy().put(userId, new ReadReceipt(now));
                    if (message.getStatus().canTransitionTo(MessageStatus.READ)) {
                        message.setStatus(MessageStatus.READ);
                    }
                    message.setUpdatedAt(now);
                    messageRepository.save(message);
                    newlyRead.add(message.getId());
                    if (!notify.contains(message.getSenderId())) {
                        notify.add(message.getSenderId());
                    }
                }
            }
            reader.setUnreadCount(0);
            reader.setLastSeen(now);
            conversationRepository.save(conversation);
            return new MarkReadResult(conversationId, userId, newlyRead, notify, now);
        });
    }

    public Message editMessage(Long messageId, String userId, String newText) {
        validateText(newText);
        Message edited = retryTemplate.execute("editMessage", () -> {
            Message message = load(messageId);
            if (!message.getSenderId().equals(userId)) {
                throw new AuthorizationFailureException("Only the sender can edit message " + messageId);
            }
            requireVisibleTo(message, userId);
            if (message.getType() != MessageType.TEXT) {
                throw new ValidationFailureException("Only text messages can be edited");
            }
            if (newText.equals(message.getOriginalText())) {
                return message;
            }
            OffsetDateTime now = now();
            message.getEditHistory().add(new EditRecord(message.getOriginalText(), now));
            message.setOriginalText(newText);
            message.setEdited(true);
            // stored translations describe the old text
            message.getTranslations().clear();
            message.setUpdatedAt(now);
            return messageRepository.save(message);
        });
        log.debug("Message {} edited by {} ({} prior versions)", messageId, userId, edited.getEditHistory().size());
        return edited;
    }

    /**
     * Sets the caller's reaction, replacing any previous one.
     */
    public ReactionChange setReaction(Long messageId, String userId, String emoji) {
        if (emoji == null || emoji.isBlank() || emoji.length() > MAX_EMOJI_LENGTH) {
            throw new ValidationFailureException("Reaction must be a non-empty emoji of at most " + MAX_EMOJI_LENGTH + " characters");
        }
        String value = emoji.trim();
        return retryTemplate.execute("setReaction", () -> {
            Message message = load(messageId);
            Conversation conversation = requireVisibleTo(message, userId);
            MessageReaction current = message.getReactions().get(userId);
            if (current != null && current.getEmoji().equals(value)) {
                return new ReactionChange(message, userId, value, true, false, conversation.otherActiveParticipantIds(userId));
            }
            message.getReactions().put(userId, new MessageReaction(value, now()));
            message.setUpdatedAt(now());
            Message saved = messageRepository.save(message);
            return new ReactionChange(saved, userId, value, true, true, conversation.otherActiveParticipantIds(userId));
        });
    }

    /**
     * Clears the caller's reaction. When {@code emoji} is given, only a matching reaction is removed.
     */
    public ReactionChange clearReaction(Long messageId, String userId, String emoji) {
        return retryTemplate.execute("clearReaction", () -> {
            Message message = load(messageId);
            Conversation conversation = requireVisibleTo(message, userId);
            MessageReaction current = message.getReactions().get(userId);
            boolean matches = current != null && (emoji == null || emoji.isBlank() || current.getEmoji().equals(emoji.trim()));
            if (!matches) {
                return new ReactionChange(message, userId, emoji, false, false, conversation.otherActiveParticipantIds(userId));
            }
            message.getReactions().remove(userId);
            message.setUpdatedAt(now());
            Message saved = messageRepository.save(message);
            return new ReactionChange(saved, userId, current.getEmoji(), false, true, conversation.otherActiveParticipantIds(userId));
        });
    }

    /**
     * Soft-removes a message of the caller. The row stays so that replies and edit history
     * keep resolving.
     */
    public MessageRemoval removeMessage(Long messageId, String userId) {
        return retryTemplate.execute("removeMessage", () -> {
            Message message = load(messageId);
            if (!message.getSenderId().equals(userId)) {
                throw new AuthorizationFailureException("Only the sender can remove message " + messageId);
            }
            Conversation conversation = conversationStore.load(message.getConversationId());
            requireActiveParticipant(conversation, userId);
            if (!message.isRemoved()) {
                markRemoved(message);
            }
            return new MessageRemoval(messageId, message.getConversationId(), conversation.otherActiveParticipantIds(userId));
        });
    }

    /**
     * Moves a message to delivered if it has not progressed further yet.
     */
    public boolean markDelivered(Long messageId) {
        return retryTemplate.execute("markDelivered", () -> {
            Message message = load(messageId);
            if (!message.getStatus().canTransitionTo(MessageStatus.DELIVERED)) {
                return false;
            }
            message.setStatus(MessageStatus.DELIVERED);
            message.setUpdatedAt(now());
            messageRepository.save(message);
            return true;
        });
    }

    /**
     * Stores a translation of {@code sourceText} unless one for the language already exists,
     * in which case the existing one is returned. When the message was edited after
     * {@code sourceText} was read, the translation is returned without being stored.
     */
    public MessageTranslation addTranslation(Long messageId, String language, String sourceText, String text, double confidence) {
        return retryTemplate.execute("addTranslation", () -> {
            Message message = load(messageId);
            MessageTranslation translation = MessageTranslation.builder()
                    .text(text)
                    .confidence(confidence)
                    .translatedAt(now())
                    .build();
            if (!message.getOriginalText().equals(sourceText)) {
                log.debug("Not storing {} translation of message {}: text changed while translating", language, messageId);
                return translation;
            }
            MessageTranslation existing = message.getTranslations().get(language);
            if (existing != null) {
                return existing;
            }
            message.getTranslations().put(language, translation);
            messageRepository.save(message);
            return translation;
        });
    }

    public PageResult<Message> searchMessages(String userId, String query, Long conversationId, Integer page, Integer limit) {
        if (query == null || query.isBlank() || query.trim().length() > MAX_SEARCH_LENGTH) {
            throw new ValidationFailureException("Search query must be 1-" + MAX_SEARCH_LENGTH + " characters");
        }
        AppProperties.Store store = appProperties.getStore();
        int pageNumber = normalizePage(page);
        int pageSize = normalizeLimit(limit, store.getDefaultMessagePageSize(), store.getMaxMessagePageSize());

        List<Long> scope;
        if (conversationId != null) {
            conversationStore.getForParticipant(conversationId, userId);
            scope = List.of(conversationId);
        } else {
            scope = conversationStore.activeConversationIds(userId);
        }
        if (scope.isEmpty()) {
            return new PageResult<>(List.of(), pageNumber, pageSize, 0);
        }
        String pattern = "%" + escapeLike(query.trim().toLowerCase(Locale.ROOT)) + "%";
        List<Message> hits = messageRepository.searchInConversations(scope, pattern, pageSize, (long) (pageNumber - 1) * pageSize);
        return new PageResult<>(hits, pageNumber, pageSize, messageRepository.countSearchHits(scope, pattern));
    }

    /**
     * Soft-removes temporary messages whose expiry has passed.
     */
    public List<MessageRemoval> expireMessages(OffsetDateTime now) {
        List<MessageRemoval> removals = new ArrayList<>();
        for (Long id : messageRepository.findExpiredIds(now)) {
            MessageRemoval removal = retryTemplate.execute("expireMessage", () -> {
                Message message = load(id);
                if (message.isRemoved()) {
                    return null;
                }
                markRemoved(message);
                Conversation conversation = conversationStore.load(message.getConversationId());
                // the sender's own devices drop the message too
                List<String> notify = conversation.getParticipants().stream()
                        .filter(p -> !p.hasLeft())
                        .map(ConversationParticipant::getUserId)
                        .toList();
                return new MessageRemoval(id, message.getConversationId(), notify);
            });
            if (removal != null) {
                removals.add(removal);
            }
        }
        return removals;
    }

    private void markRemoved(Message message) {
        OffsetDateTime now = now();
        message.setRemoved(true);
        message.setRemovedAt(now);
        message.setUpdatedAt(now);
        messageRepository.save(message);
    }

    private Message load(Long messageId) {
        if (messageId == null) {
            throw new ValidationFailureException("Message id is required");
        }
        return messageRepository.findById(messageId).orElseThrow(() -> ResourceNotFoundException.message(messageId));
    }

    private Conversation requireVisibleTo(Message message, String userId) {
        Conversation conversation = conversationStore.load(message.getConversationId());
        requireActiveParticipant(conversation, userId);
        if (message.isRemoved()) {
            throw ResourceNotFoundException.message(message.getId());
        }
        return conversation;
    }

    private void rejectBlocked(Conversation conversation, String senderId) {
        boolean blockedInConversation = conversation.otherActiveParticipants(senderId).anyMatch(ConversationParticipant::isBlocked);
        if (blockedInConversation) {
            throw new AuthorizationFailureException("The recipient has blocked conversation " + conversation.getId());
        }
        Optional<String> peer = conversation.peerOf(senderId);
        if (peer.isPresent() && directoryService.isBlockedBetween(senderId, peer.get())) {
            throw new AuthorizationFailureException("Messaging between " + senderId + " and " + peer.get() + " is blocked");
        }
    }

    /**
     * Fills an empty forward with the content of the original message after checking the
     * sender can see that message.
     */
    private SendMessageCommand resolveForward(SendMessageCommand command, String senderId) {
        if (command.getForwardFromMessageId() == null) {
            return command;
        }
        Message original = getForParticipant(command.getForwardFromMessageId(), senderId);
        boolean hasOwnContent = command.getText() != null && !command.getText().isBlank()
                || command.getVoice() != null || command.getMedia() != null;
        if (hasOwnContent) {
            return command;
        }
        return command.withType(original.getType())
                .withText(original.getOriginalText())
                .withLanguage(original.getOriginalLanguage())
                .withVoice(original.getVoice())
                .withMedia(original.getMedia());
    }

    private ForwardInfo forwardInfo(SendMessageCommand resolved, SendMessageCommand command) {
        if (command.getForwardFromMessageId() == null) {
            return null;
        }
        return messageRepository.findById(command.getForwardFromMessageId())
                .map(original -> ForwardInfo.builder()
                        .fromUserId(original.getSenderId())
                        .originalMessageId(original.getId())
                        .forwardedAt(now())
                        .build())
                .orElseThrow(() -> ResourceNotFoundException.message(command.getForwardFromMessageId()));
    }

    private void validatePayload(SendMessageCommand command) {
        MessageType type = command.getType();
        if (type == null) {
            throw new ValidationFailureException("Message type is required");
        }
        if (!Language.isSupportedOrAuto(normalizeLanguage(command.getLanguage()))) {
            throw new ValidationFailureException("Unsupported language: " + command.getLanguage());
        }
        if (command.getText() != null && command.getText().length() > Constants.MAX_TEXT_LENGTH) {
            throw new ValidationFailureException("Message text must be at most " + Constants.MAX_TEXT_LENGTH + " characters");
        }
        if (command.getExpiresAt() != null && !command.getExpiresAt().isAfter(now())) {
            throw new ValidationFailureException("Expiry must be in the future");
        }
        switch (type) {
            case TEXT -> validateText(command.getText());
            case VOICE -> {
                if (command.getVoice() == null || command.getVoice().getDurationSeconds() <= 0) {
                    throw new ValidationFailureException("Voice messages require a positive duration");
                }
                if (command.getVoice().getAudioRef() == null || command.getVoice().getAudioRef().isBlank()) {
                    throw new ValidationFailureException("Voice messages require an audio reference");
                }
            }
            case IMAGE, FILE -> {
                if (command.getMedia() == null || command.getMedia().getUrl() == null || command.getMedia().getUrl().isBlank()) {
                    throw new ValidationFailureException(type.getValue() + " messages require a media url");
                }
            }
            case SYSTEM -> throw new ValidationFailureException("System messages cannot be sent by users");
        }
    }

    private static void validateText(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationFailureException("Text messages require non-empty text");
        }
        if (text.length() > Constants.MAX_TEXT_LENGTH) {
            throw new ValidationFailureException("Message text must be at most " + Constants.MAX_TEXT_LENGTH + " characters");
        }
    }

    /**
     * Wall-clock time, pushed forward when needed so that every message in a conversation
     * is strictly later than the previous one.
     */
    private static OffsetDateTime nextTimestamp(Conversation conversation) {
        OffsetDateTime now = now();
        LastMessage last = conversation.getLastMessage();
        if (last == null || last.getTimestamp() == null || now.isAfter(last.getTimestamp())) {
            return now;
        }
        return last.getTimestamp().plusNanos(1_000_000);
    }

    private static String preview(SendMessageCommand command) {
        String text = command.getText();
        if (text != null && !text.isBlank()) {
            return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
        }
        return switch (command.getType()) {
            case VOICE -> "Voice message";
            case IMAGE -> "Image";
            case FILE -> "File";
            default -> "";
        };
    }

    private static String normalizeLanguage(String language) {
        return language == null || language.isBlank() ? Constants.AUTO_LANGUAGE : language.trim().toLowerCase(Locale.ROOT);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
