package com.example.chat.messaging.typing;

import com.example.chat.messaging.event.ChatEventPublisher;
import com.example.chat.messaging.event.FanoutResult;
import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.store.TypingChange;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.util.Constants.ChatEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TypingCoordinatorTest {

    @Mock
    private ConversationStore conversationStore;

    @Mock
    private ChatEventPublisher eventPublisher;

    private AppProperties properties;
    private TypingCoordinator typingCoordinator;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.getTyping().setTtlMs(5_000);
        typingCoordinator = new TypingCoordinator(conversationStore, eventPublisher, properties,
                Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A stored typing change is broadcast to the other participants")
    void broadcastsPersistedChangeToOtherParticipants() {
        when(conversationStore.setTyping(7L, "user-001", true))
                .thenReturn(new TypingChange(7L, "user-001", true, true, List.of("user-002")));
        when(eventPublisher.fanOut(List.of("user-002"), ChatEventType.TYPING_STATUS,
                new TypingStatusPayload(7L, "user-001", true))).thenReturn(new FanoutResult(1, 0));

        assertThat(typingCoordinator.setTyping(7L, "user-001", true)).isEqualTo(new FanoutResult(1, 0));
    }

    @Test
    @DisplayName("A stop without a preceding start is not broadcast")
    void redundantStopIsNotBroadcast() {
        when(conversationStore.setTyping(7L, "user-001", false))
                .thenReturn(new TypingChange(7L, "user-001", false, false, List.of("user-002")));

        assertThat(typingCoordinator.setTyping(7L, "user-001", false)).isEqualTo(FanoutResult.NONE);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Going offline sends a stop to every active conversation, typing or not")
    void stopAllBroadcastsToEveryActiveConversation() {
        when(conversationStore.activeConversationIds("user-001")).thenReturn(List.of(7L, 8L));
        when(conversationStore.setTyping(7L, "user-001", false))
                .thenReturn(new TypingChange(7L, "user-001", false, true, List.of("user-002")));
        when(conversationStore.setTyping(8L, "user-001", false))
                .thenReturn(new TypingChange(8L, "user-001", false, false, List.of("user-003")));
        when(eventPublisher.fanOut(List.of("user-002"), ChatEventType.TYPING_STATUS,
                new TypingStatusPayload(7L, "user-001", false))).thenReturn(new FanoutResult(0, 1));
        when(eventPublisher.fanOut(List.of("user-003"), ChatEventType.TYPING_STATUS,
                new TypingStatusPayload(8L, "user-001", false))).thenReturn(new FanoutResult(1, 0));

        assertThat(typingCoordinator.stopAll("user-001")).isEqualTo(new FanoutResult(1, 1));
    }

    @Test
    @DisplayName("Flags older than the TTL are cleared and broadcast")
    void expiresFlagsOlderThanTheTtl() {
        OffsetDateTime now = OffsetDateTime.of(2026, 10, 17, 12, 0, 0, 0, ZoneOffset.UTC);
        TypingChange cleared = new TypingChange(9L, "user-004", false, true, List.of("user-005"));
        when(conversationStore.clearTypingStartedBefore(now.minusSeconds(5))).thenReturn(List.of(cleared));
        when(eventPublisher.fanOut(List.of("user-005"), ChatEventType.TYPING_STATUS,
                new TypingStatusPayload(9L, "user-004", false))).thenReturn(new FanoutResult(1, 0));

        assertThat(typingCoordinator.expireStale(now)).containsExactly(cleared);
    }

    @Test
    @DisplayName("A zero TTL disables expiry")
    void zeroTtlDisablesExpiry() {
        properties.getTyping().setTtlMs(0);

        assertThat(typingCoordinator.expireStale(OffsetDateTime.now(ZoneOffset.UTC))).isEmpty();
        verify(conversationStore, never()).clearTypingStartedBefore(any());
        verify(eventPublisher, never()).fanOut(anyCollection(), any(), any());
    }
}
