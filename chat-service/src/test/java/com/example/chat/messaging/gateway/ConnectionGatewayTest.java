package com.example.chat.messaging.gateway;

import com.example.chat.messaging.auth.ChatAuthenticator;
import com.example.chat.messaging.event.ChatEventFactory;
import com.example.chat.messaging.event.ChatEventPublisher;
import com.example.chat.messaging.event.FanoutResult;
import com.example.chat.messaging.presence.PresenceBroadcaster;
import com.example.chat.messaging.service.ChatService;
import com.example.chat.messaging.session.MutableClock;
import com.example.chat.messaging.session.RecordingSessionHandle;
import com.example.chat.messaging.session.SessionExpiredEvent;
import com.example.chat.messaging.session.SessionRegistry;
import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.typing.TypingCoordinator;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.AuthenticationFailureException;
import com.example.chat.shared.exception.AuthorizationFailureException;
import com.example.chat.shared.exception.RateLimitedException;
import com.example.chat.shared.util.Constants.PresenceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConnectionGateway Unit Tests")
class ConnectionGatewayTest {

    @Mock
    private ChatAuthenticator authenticator;

    @Mock
    private PresenceBroadcaster presenceBroadcaster;

    @Mock
    private TypingCoordinator typingCoordinator;

    @Mock
    private ConversationStore conversationStore;

    @Mock
    private ChatService chatService;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-17T08:00:00Z"));
    private SessionRegistry sessionRegistry;
    private ConnectionGateway gateway;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        ChatEventFactory eventFactory = new ChatEventFactory(objectMapper);
        AtomicReference<ConnectionGateway> listener = new AtomicReference<>();
        sessionRegistry = new SessionRegistry(eventFactory, event -> {
            if (event instanceof SessionExpiredEvent expired) {
                listener.get().onSessionExpired(expired);
            }
        }, new AppProperties(), clock);
        ChatEventPublisher eventPublisher = new ChatEventPublisher(sessionRegistry, eventFactory,
                new MonitoringConfig.ChatMetricsCollector(new SimpleMeterRegistry()));
        gateway = new ConnectionGateway(authenticator, sessionRegistry, presenceBroadcaster, typingCoordinator,
                conversationStore, chatService, eventFactory, eventPublisher, objectMapper, Schedulers.immediate());
        listener.set(gateway);

        lenient().when(presenceBroadcaster.transition(any(), any())).thenReturn(FanoutResult.NONE);
        lenient().when(typingCoordinator.stopAll(any())).thenReturn(FanoutResult.NONE);
    }

    @Test
    @DisplayName("Connecting registers the session and announces the user online")
    void connectRegistersAndGoesOnline() {
        when(authenticator.authenticate("token-1")).thenReturn("user-001");
        RecordingSessionHandle handle = new RecordingSessionHandle("s-1");

        StepVerifier.create(gateway.connect("token-1", handle))
                .expectNext("user-001")
                .verifyComplete();

        assertThat(sessionRegistry.lookup("user-001")).containsSame(handle);
        assertThat(handle.received("connected")).isTrue();
        verify(presenceBroadcaster).transition("user-001", PresenceStatus.ONLINE);
    }

    @Test
    @DisplayName("A rejected token closes the connection without registering it")
    void authenticationFailureClosesHandle() {
        when(authenticator.authenticate("bad")).thenThrow(new AuthenticationFailureException("Invalid token"));
        RecordingSessionHandle handle = new RecordingSessionHandle("s-2");

        StepVerifier.create(gateway.connect("bad", handle)).verifyComplete();

        assertThat(handle.isOpen()).isFalse();
        assertThat(handle.lastFrame()).contains("\"code\":\"AUTHENTICATION_FAILED\"");
        assertThat(sessionRegistry.registeredCount()).isZero();
        verify(presenceBroadcaster, never()).transition(any(), any());
    }

    @Test
    @DisplayName("An evicted session that later closes only goes offline once")
    void sweepThenDisconnectGoesOfflineOnce() {
        when(authenticator.authenticate("token-3")).thenReturn("user-003");
        RecordingSessionHandle handle = new RecordingSessionHandle("s-3");
        gateway.connect("token-3", handle).block();

        clock.advance(Duration.ofMinutes(6));
        assertThat(sessionRegistry.sweepStaleSessions(clock.instant())).containsExactly("user-003");
        gateway.onDisconnect("user-003", handle).block();

        verify(presenceBroadcaster, times(1)).transition("user-003", PresenceStatus.OFFLINE);
        verify(typingCoordinator, times(1)).stopAll("user-003");
    }

    @Test
    void closingAReplacedConnectionKeepsTheUserOnline() {
        when(authenticator.authenticate("token-4")).thenReturn("user-004");
        RecordingSessionHandle first = new RecordingSessionHandle("s-4a");
        RecordingSessionHandle second = new RecordingSessionHandle("s-4b");
        gateway.connect("token-4", first).block();
        gateway.connect("token-4", second).block();

        gateway.onDisconnect("user-004", first).block();

        assertThat(sessionRegistry.isOnline("user-004")).isTrue();
        verify(presenceBroadcaster, never()).transition("user-004", PresenceStatus.OFFLINE);
    }

    @Test
    void pingIsAnsweredWithPong() {
        RecordingSessionHandle handle = connected("user-005", "s-5");

        gateway.onInbound("user-005", handle, "{\"event\":\"ping\",\"data\":{}}").block();

        assertThat(handle.received("pong")).isTrue();
    }

    @Test
    void signalIsRelayedToConnectedTarget() {
        RecordingSessionHandle caller = connected("user-006", "s-6");
        RecordingSessionHandle callee = connected("user-007", "s-7");

        gateway.onInbound("user-006", caller,
                "{\"event\":\"webrtc_offer\",\"data\":{\"targetUserId\":\"user-007\",\"conversationId\":12,\"payload\":{\"sdp\":\"v=0\"}}}")
                .block();

        assertThat(callee.received("webrtc_offer")).isTrue();
        assertThat(callee.lastFrame())
                .contains("\"fromUserId\":\"user-006\"")
                .contains("\"conversationId\":12")
                .contains("\"sdp\":\"v=0\"");
        assertThat(caller.received("signal_failed")).isFalse();
    }

    @Test
    void signalToOfflineTargetIsReportedToSender() {
        RecordingSessionHandle caller = connected("user-008", "s-8");

        gateway.onInbound("user-008", caller,
                "{\"event\":\"voice_call_request\",\"data\":{\"targetUserId\":\"user-009\"}}").block();

        assertThat(caller.received("signal_failed")).isTrue();
        assertThat(caller.lastFrame()).contains("\"targetUserId\":\"user-009\"").contains("\"event\":\"voice_call_request\"");
    }

    @Test
    void malformedFrameIsReportedWithoutClosing() {
        RecordingSessionHandle handle = connected("user-010", "s-10");

        gateway.onInbound("user-010", handle, "not json").block();
        gateway.onInbound("user-010", handle, "{\"event\":\"dance\"}").block();
        gateway.onInbound("user-010", handle, "{\"event\":\"typing_start\",\"data\":{}}").block();

        assertThat(handle.frames()).filteredOn(frame -> frame.contains("\"code\":\"VALIDATION_FAILED\"")).hasSize(3);
        assertThat(handle.isOpen()).isTrue();
    }

    @Test
    void rateLimitedEventCarriesRetryHint() {
        RecordingSessionHandle handle = connected("user-011", "s-11");
        when(chatService.setTyping(3L, "user-011", true))
                .thenReturn(Mono.error(new RateLimitedException("typing", Duration.ofSeconds(10))));

        gateway.onInbound("user-011", handle, "{\"event\":\"typing_start\",\"data\":{\"conversationId\":3}}").block();

        assertThat(handle.lastFrame()).contains("\"code\":\"RATE_LIMITED\"").contains("\"retryAfterMs\":10000");
    }

    @Test
    void joiningForeignConversationIsRefused() {
        RecordingSessionHandle handle = connected("user-012", "s-12");
        when(conversationStore.getForParticipant(44L, "user-012"))
                .thenThrow(new AuthorizationFailureException("not a participant"));

        gateway.onInbound("user-012", handle, "{\"event\":\"join_conversation\",\"data\":{\"conversationId\":\"44\"}}").block();

        assertThat(handle.lastFrame()).contains("\"code\":\"AUTHORIZATION_FAILED\"");
        assertThat(handle.received("conversation_joined")).isFalse();
    }

    @Test
    void statusUpdateIsBroadcast() {
        RecordingSessionHandle handle = connected("user-013", "s-13");

        gateway.onInbound("user-013", handle, "{\"event\":\"update_status\",\"data\":{\"status\":\"busy\"}}").block();
        gateway.onInbound("user-013", handle, "{\"event\":\"update_status\",\"data\":{\"status\":\"sleeping\"}}").block();

        verify(presenceBroadcaster).transition("user-013", PresenceStatus.BUSY);
        assertThat(handle.lastFrame()).contains("\"code\":\"VALIDATION_FAILED\"");
    }

    private RecordingSessionHandle connected(String userId, String sessionId) {
        RecordingSessionHandle handle = new RecordingSessionHandle(sessionId);
        sessionRegistry.register(userId, handle);
        return handle;
    }
}
