package com.example.chat.messaging.store;

import com.example.chat.messaging.directory.DirectoryService;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.AuthorizationFailureException;
import com.example.chat.shared.exception.ResourceNotFoundException;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.Conversation;
import com.example.chat.shared.model.ConversationParticipant;
import com.example.chat.shared.model.ConversationSettings;
import com.example.chat.shared.repository.ConversationRepository;
import com.example.chat.shared.service.OptimisticRetryTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the conversation aggregate: creation per user pair, participant status records,
 * settings and leaving. Every mutation is a compare-and-retry on the conversation version.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("store")
public class ConversationStore {

    private final ConversationRepository conversationRepository;
    private final DirectoryService directoryService;
    private final OptimisticRetryTemplate retryTemplate;
    private final AppProperties appProperties;

    /**
     * Returns the active conversation between the two users, creating it on first contact.
     * Concurrent callers for the same pair all receive the same conversation: the unique pair
     * key lets exactly one insert win and the others re-read it.
     */
    public Conversation getOrCreateConversation(String userId, String peerId) {
        if (userId == null || userId.isBlank() || peerId == null || peerId.isBlank()) {
            throw new ValidationFailureException("Both participants are required");
        }
        if (userId.equals(peerId)) {
            throw new ValidationFailureException("Cannot start a conversation with yourself");
        }
        if (!directoryService.isActiveUser(peerId)) {
            throw ResourceNotFoundException.user(peerId);
        }
        if (directoryService.isBlockedBetween(userId, peerId)) {
            throw new AuthorizationFailureException("Conversation between " + userId + " and " + peerId + " is blocked");
        }

        String pairKey = Conversation.pairKeyOf(userId, peerId);
        int maxAttempts = appProperties.getStore().getMaxRetryAttempts();
        for (int attempt = 1; ; attempt++) {
            Optional<Conversation> existing = conversationRepository.findByPairKey(pairKey);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                Conversation created = retryTemplate.execute("createConversation",
                        () -> conversationRepository.save(newConversation(pairKey, userId, peerId)));
                log.info("Created conversation {} for pair {}", created.getId(), pairKey);
                return created;
            } catch (RuntimeException e) {
                if (!isDuplicateKey(e) || attempt >= maxAttempts) {
                    throw e;
                }
                log.debug("Lost creation race for pair {}, re-reading", pairKey);
            }
        }
    }

    public Conversation getForParticipant(Long conversationId, String userId) {
        Conversation conversation = load(conversationId);
        requireActiveParticipant(conversation, userId);
        return conversation;
    }

    public PageResult<Conversation> listConversations(String userId, Integer page, Integer limit) {
        AppProperties.Store store = appProperties.getStore();
        int pageNumber = normalizePage(page);
        int pageSize = normalizeLimit(limit, store.getDefaultConversationPageSize(), store.getMaxConversationPageSize());
        long offset = (long) (pageNumber - 1) * pageSize;
        List<Conversation> items = conversationRepository.findActiveByParticipant(userId, pageSize, offset);
        long total = conversationRepository.countActiveByParticipant(userId);
        return new PageResult<>(items, pageNumber, pageSize, total);
    }

    public List<Long> activeConversationIds(String userId) {
        return conversationRepository.findActiveConversationIds(userId);
    }

    public Conversation updateSettings(Long conversationId, String userId, SettingsUpdate update) {
        return retryTemplate.execute("updateSettings", () -> {
            Conversation conversation = load(conversationId);
            ConversationParticipant self = requireActiveParticipant(conversation, userId);
            ConversationSettings settings = conversation.getSettings();
            if (update.getAutoTranslate() != null) {
                settings.setAutoTranslate(update.getAutoTranslate());
            }
            if (update.getNotifications() != null) {
                settings.setNotifications(update.getNotifications());
            }
            if (update.getMuted() != null) {
                self.setMuted(update.getMuted());
            }
            if (update.getBlocked() != null) {
                self.setBlocked(update.getBlocked());
            }
            return conversationRepository.save(conversation);
        });
    }

    /**
     * Removes the caller from the conversation. The pair key is released so that the two
     * users can start a fresh conversation later; the conversation goes inactive once no
     * participant is left.
     */
    public Conversation leaveConversation(Long conversationId, String userId) {
        Conversation left = retryTemplate.execute("leaveConversation", () -> {
            Conversation conversation = load(conversationId);
            ConversationParticipant self = requireActiveParticipant(conversation, userId);
            OffsetDateTime now = now();
            self.setLeftAt(now);
            self.setTyping(false);
            self.setUnreadCount(0);
            conversation.setPairKey(null);
            boolean anyoneLeft = conversation.getParticipants().stream().anyMatch(p -> !p.hasLeft());
            conversation.setActive(anyoneLeft);
            conversation.setUpdatedAt(now);
            return conversationRepository.save(conversation);
        });
        log.info("User {} left conversation {} (still active: {})", userId, conversationId, left.isActive());
        return left;
    }

    /**
     * Records a typing flag. The row is only rewritten when the flag actually changes or a
     * fresh start refreshes {@code lastTypingAt}.
     */
    public TypingChange setTyping(Long conversationId, String userId, boolean typing) {
        return retryTemplate.execute("setTyping", () -> {
            Conversation conversation = load(conversationId);
            ConversationParticipant self = requireActiveParticipant(conversation, userId);
            List<String> recipients = conversation.otherActiveParticipantIds(userId);
            if (!typing && !self.isTyping()) {
                return new TypingChange(conversationId, userId, false, false, recipients);
            }
            self.setTyping(typing);
            if (typing) {
                self.setLastTypingAt(now());
            }
            conversationRepository.save(conversation);
            return new TypingChange(conversationId, userId, typing, true, recipients);
        });
    }

    /**
     * Clears typing flags whose last start is older than {@code cutoff}.
     */
    public List<TypingChange> clearTypingStartedBefore(OffsetDateTime cutoff) {
        Map<Long, Conversation> candidates = new LinkedHashMap<>();
        conversationRepository.findWithTypingStartedBefore(cutoff).forEach(c -> candidates.putIfAbsent(c.getId(), c));

        List<TypingChange> cleared = new ArrayList<>();
        for (Long conversationId : candidates.keySet()) {
            cleared.addAll(retryTemplate.execute("clearStaleTyping", () -> {
                Conversation conversation = load(conversationId);
                List<TypingChange> changes = new ArrayList<>();
                for (ConversationParticipant participant : conversation.getParticipants()) {
                    if (participant.isTyping() && participant.getLastTypingAt() != null
                            && participant.getLastTypingAt().isBefore(cutoff)) {
                        participant.setTyping(false);
                        changes.add(new TypingChange(conversationId, participant.getUserId(), false, true,
                                conversation.otherActiveParticipantIds(participant.getUserId())));
                    }
                }
                if (!changes.isEmpty()) {
                    conversationRepository.save(conversation);
                }
                return changes;
            }));
        }
        return cleared;
    }

    public Conversation load(Long conversationId) {
        if (conversationId == null) {
            throw new ValidationFailureException("Conversation id is required");
        }
        return conversationRepository.findById(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));
    }

    static ConversationParticipant requireActiveParticipant(Conversation conversation, String userId) {
        return conversation.activeParticipant(userId)
                .orElseThrow(() -> new AuthorizationFailureException(
                        "User " + userId + " is not an active participant of conversation " + conversation.getId()));
    }

    static int normalizePage(Integer page) {
        return page == null || page < 1 ? 1 : page;
    }

    static int normalizeLimit(Integer limit, int defaultLimit, int maxLimit) {
        if (limit == null || limit < 1) {
            return defaultLimit;
        }
        return Math.min(limit, maxLimit);
    }

    static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }

    private static Conversation newConversation(String pairKey, String userId, String peerId) {
        OffsetDateTime now = now();
        Set<ConversationParticipant> participants = new HashSet<>();
        participants.add(ConversationParticipant.builder().userId(userId).joinedAt(now).lastSeen(now).build());
        participants.add(ConversationParticipant.builder().userId(peerId).joinedAt(now).build());
        return Conversation.builder()
                .pairKey(pairKey)
                .active(true)
                .messageSequence(0)
                .settings(ConversationSettings.builder().autoTranslate(true).notifications(true).build())
                .participants(participants)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static boolean isDuplicateKey(Throwable error) {
        for (Throwable t = error; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof DataIntegrityViolationException) {
                return true;
            }
            if (t instanceof SQLException sql && "23505".equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
