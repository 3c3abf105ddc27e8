package com.example.chat.messaging.service;

import com.example.chat.messaging.event.FanoutResult;
import com.example.chat.messaging.store.MessageRemoval;
import com.example.chat.messaging.store.MessageStore;
import org.junit.jupiter.api.BeforeEach;
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
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TemporaryMessageExpiryServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 10, 17, 6, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private MessageStore messageStore;

    @Mock
    private ChatService chatService;

    private TemporaryMessageExpiryService expiryService;

    @BeforeEach
    void setUp() {
        expiryService = new TemporaryMessageExpiryService(messageStore, chatService,
                Clock.fixed(Instant.from(NOW), ZoneOffset.UTC));
    }

    @Test
    void announcesEveryRemovalEvenWhenOneFails() {
        MessageRemoval first = new MessageRemoval(1L, 10L, List.of("user-001", "user-002"));
        MessageRemoval second = new MessageRemoval(2L, 10L, List.of("user-001", "user-002"));
        when(messageStore.expireMessages(NOW)).thenReturn(List.of(first, second));
        when(chatService.announceRemoval(first)).thenThrow(new IllegalStateException("publisher down"));
        when(chatService.announceRemoval(second)).thenReturn(new FanoutResult(2, 0));

        expiryService.expireTemporaryMessages();

        verify(chatService).announceRemoval(second);
    }

    @Test
    void nothingExpiredMeansNothingAnnounced() {
        when(messageStore.expireMessages(NOW)).thenReturn(List.of());

        assertThat(expiryService.expireAt(NOW)).isZero();
        verifyNoInteractions(chatService);
    }
}
