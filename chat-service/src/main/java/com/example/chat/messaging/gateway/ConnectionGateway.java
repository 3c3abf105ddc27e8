package com.example.chat.messaging.gateway;

import com.example.chat.messaging.auth.ChatAuthenticator;
import com.example.chat.messaging.dto.EventPayloads;
import com.example.chat.messaging.event.ChatEventFactory;
import com.example.chat.messaging.event.ChatEventPublisher;
import com.example.chat.messaging.presence.PresenceBroadcaster;
import com.example.chat.messaging.service.ChatService;
import com.example.chat.messaging.session.SessionExpiredEvent;
import com.example.chat.messaging.session.SessionHandle;
import com.example.chat.messaging.session.SessionRegistry;
import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.typing.TypingCoordinator;
import com.example.chat.shared.exception.AuthenticationFailureException;
import com.example.chat.shared.exception.ChatException;
import com.example.chat.shared.exception.ErrorCode;
import com.example.chat.shared.exception.RateLimitedException;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.util.Constants.ChatEventType;
import com.example.chat.shared.util.Constants.InboundEventType;
import com.example.chat.shared.util.Constants.PresenceStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifecycle and inbound dispatch of real-time connections: authenticate and register on
 * connect, route client events, and take the user offline when the current session ends
 * or is evicted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionGateway {

    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final ChatAuthenticator authenticator;
    private final SessionRegistry sessionRegistry;
    private final PresenceBroadcaster presenceBroadcaster;
    private final TypingCoordinator typingCoordinator;
    private final ConversationStore conversationStore;
    private final ChatService chatService;
    private final ChatEventFactory eventFactory;
    private final ChatEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Scheduler jdbcScheduler;

    /**
     * Authenticates the connection and makes it the user's current session.
     *
     * @return the user id, or empty when authentication failed and the handle was closed
     */
    public Mono<String> connect(String token, SessionHandle handle) {
        return Mono.fromCallable(() -> {
                    String userId = authenticator.authenticate(token);
                    sessionRegistry.register(userId, handle);
                    handle.send(eventFactory.createConnectedEvent(userId, handle.id()));
                    goOnline(userId);
                    return userId;
                })
                .subscribeOn(jdbcScheduler)
                .onErrorResume(AuthenticationFailureException.class, e -> {
                    log.warn("Rejected connection {}: {}", handle.id(), e.getMessage());
                    handle.send(eventFactory.createErrorEvent(ErrorCode.AUTHENTICATION_FAILED.name(), e.getMessage(), null));
                    handle.close("authentication failed");
                    return Mono.empty();
                });
    }

    /**
     * Handles one client frame. Failures are reported to the client as an {@code error}
     * event and never end the connection.
     */
    public Mono<Void> onInbound(String userId, SessionHandle handle, String frame) {
        sessionRegistry.touch(userId);
        return Mono.defer(() -> dispatch(userId, handle, frame))
                .onErrorResume(e -> {
                    reportError(userId, handle, e);
                    return Mono.empty();
                });
    }

    /**
     * Called when a connection ends. Only the user's current session takes the user offline.
     */
    public Mono<Void> onDisconnect(String userId, SessionHandle handle) {
        if (userId == null) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> {
                    if (sessionRegistry.deregister(userId, handle)) {
                        goOffline(userId);
                    }
                })
                .subscribeOn(jdbcScheduler)
                .onErrorResume(e -> {
                    log.error("Error while disconnecting user {}: {}", userId, e.getMessage(), e);
                    return Mono.empty();
                })
                .then();
    }

    @EventListener
    public void onSessionExpired(SessionExpiredEvent event) {
        log.info("Session {} of user {} expired ({})", event.handle().id(), event.userId(), event.reason());
        try {
            goOffline(event.userId());
        } catch (RuntimeException e) {
            log.error("Error taking user {} offline after eviction: {}", event.userId(), e.getMessage(), e);
        }
    }

    private Mono<Void> dispatch(String userId, SessionHandle handle, String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            return Mono.error(new ValidationFailureException("Frame is not valid JSON"));
        }
        String eventName = root.path("event").asText(null);
        InboundEventType type = InboundEventType.fromWireName(eventName);
        if (type == null) {
            return Mono.error(new ValidationFailureException("Unknown event: " + eventName));
        }
        JsonNode data = root.path("data");
        if (type.isSignaling()) {
            return blocking(() -> relaySignal(userId, type, data));
        }
        return switch (type) {
            case JOIN_CONVERSATION -> blocking(() -> {
                Long conversationId = requireLong(data, "conversationId");
                conversationStore.getForParticipant(conversationId, userId);
                handle.send(eventFactory.createEvent(ChatEventType.CONVERSATION_JOINED,
                        new EventPayloads.ConversationMembership(conversationId, userId)));
            });
            case LEAVE_CONVERSATION -> blocking(() -> {
                Long conversationId = requireLong(data, "conversationId");
                typingCoordinator.setTyping(conversationId, userId, false);
                handle.send(eventFactory.createEvent(ChatEventType.CONVERSATION_LEFT,
                        new EventPayloads.ConversationMembership(conversationId, userId)));
            });
            case TYPING_START -> chatService.setTyping(requireLong(data, "conversationId"), userId, true).then();
            case TYPING_STOP -> chatService.setTyping(requireLong(data, "conversationId"), userId, false).then();
            case REACTION_ADD -> chatService.setReaction(requireLong(data, "messageId"), userId,
                    requireText(data, "emoji")).then();
            case REACTION_REMOVE -> chatService.clearReaction(requireLong(data, "messageId"), userId,
                    data.path("emoji").asText(null)).then();
            case UPDATE_STATUS -> blocking(() -> presenceBroadcaster.transition(userId, parseStatus(requireText(data, "status"))));
            case PING -> Mono.fromRunnable(() -> handle.send(eventFactory.createEvent(ChatEventType.PONG,
                    new EventPayloads.Pong(OffsetDateTime.now(ZoneOffset.UTC)))));
            default -> Mono.error(new ValidationFailureException("Unsupported event: " + eventName));
        };
    }

    /**
     * Forwards a call-signaling payload to its target untouched. The sender learns about an
     * offline target through {@code signal_failed}.
     */
    private void relaySignal(String userId, InboundEventType type, JsonNode data) {
        String target = requireText(data, "targetUserId");
        Map<String, Object> relayed = new LinkedHashMap<>();
        relayed.put("fromUserId", userId);
        if (data.hasNonNull("conversationId")) {
            relayed.put("conversationId", data.get("conversationId").asLong());
        }
        relayed.put("payload", data.path("payload"));
        boolean delivered = eventPublisher.sendFrame(target, eventFactory.createFrame(type.wireName(), relayed), type.wireName());
        if (!delivered) {
            log.debug("Signal {} from {} to {} not delivered", type.wireName(), userId, target);
            eventPublisher.sendTo(userId, ChatEventType.SIGNAL_FAILED,
                    new EventPayloads.SignalFailed(target, type.wireName(), "target is not connected"));
        }
    }

    private void goOnline(String userId) {
        try {
            presenceBroadcaster.transition(userId, PresenceStatus.ONLINE);
        } catch (RuntimeException e) {
            log.warn("Could not publish online status for {}: {}", userId, e.getMessage());
        }
    }

    private void goOffline(String userId) {
        presenceBroadcaster.transition(userId, PresenceStatus.OFFLINE);
        typingCoordinator.stopAll(userId);
    }

    private void reportError(String userId, SessionHandle handle, Throwable error) {
        String frame;
        if (error instanceof RateLimitedException limited) {
            frame = eventFactory.createErrorEvent(limited.getErrorCode().name(), limited.getMessage(),
                    limited.getRetryAfter().toMillis());
        } else if (error instanceof ChatException chat) {
            log.debug("Inbound event from {} rejected: {}", userId, chat.getMessage());
            frame = eventFactory.createErrorEvent(chat.getErrorCode().name(), chat.getMessage(), null);
        } else {
            log.error("Error handling inbound event from {}: {}", userId, error.getMessage(), error);
            frame = eventFactory.createErrorEvent(INTERNAL_ERROR, "Unexpected error", null);
        }
        handle.send(frame);
    }

    private static PresenceStatus parseStatus(String status) {
        try {
            return PresenceStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationFailureException("Unknown status: " + status);
        }
    }

    private static Long requireLong(JsonNode data, String field) {
        JsonNode value = data.path(field);
        if (!value.canConvertToLong() && !(value.isTextual() && value.asText().matches("\\d+"))) {
            throw new ValidationFailureException(field + " is required");
        }
        return value.asLong();
    }

    private static String requireText(JsonNode data, String field) {
        String value = data.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new ValidationFailureException(field + " is required");
        }
        return value;
    }

    private Mono<Void> blocking(Runnable work) {
        return Mono.fromRunnable(work).subscribeOn(jdbcScheduler).then();
    }
}
