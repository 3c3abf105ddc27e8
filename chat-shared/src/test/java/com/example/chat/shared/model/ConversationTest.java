package com.example.chat.shared.model;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationTest {

    @Test
    void pairKeyIsIndependentOfOrder() {
        assertThat(Conversation.pairKeyOf("user-002", "user-001")).isEqualTo("user-001|user-002");
        assertThat(Conversation.pairKeyOf("user-001", "user-002")).isEqualTo("user-001|user-002");
    }

    @Test
    void participantsWhoLeftAreNotActive() {
        OffsetDateTime joined = OffsetDateTime.of(2026, 10, 1, 9, 0, 0, 0, ZoneOffset.UTC);
        Conversation conversation = Conversation.builder()
                .id(1L)
                .participants(new HashSet<>(List.of(
                        ConversationParticipant.builder().userId("user-001").joinedAt(joined).build(),
                        ConversationParticipant.builder().userId("user-002").joinedAt(joined)
                                .leftAt(joined.plusDays(1)).build())))
                .build();

        assertThat(conversation.isActiveParticipant("user-001")).isTrue();
        assertThat(conversation.isActiveParticipant("user-002")).isFalse();
        assertThat(conversation.participant("user-002")).isPresent();
        assertThat(conversation.otherActiveParticipantIds("user-002")).containsExactly("user-001");
        assertThat(conversation.otherActiveParticipantIds("user-001")).isEmpty();
        assertThat(conversation.peerOf("user-001")).contains("user-002");
    }
}
