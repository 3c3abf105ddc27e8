package com.example.chat.messaging.store;

import com.example.chat.shared.exception.AuthorizationFailureException;
import com.example.chat.shared.exception.ResourceNotFoundException;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.Conversation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("ConversationStore Integration Tests")
class ConversationStoreTest {

    @Autowired
    private ConversationStore conversationStore;

    @Test
    @DisplayName("Concurrent first contact yields a single conversation")
    void concurrentGetOrCreateReturnsSameConversation() throws Exception {
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                boolean reversed = i % 2 == 0;
                Callable<Long> call = () -> {
                    start.await();
                    return reversed
                            ? conversationStore.getOrCreateConversation("user-002", "user-001").getId()
                            : conversationStore.getOrCreateConversation("user-001", "user-002").getId();
                };
                results.add(executor.submit(call));
            }
            start.countDown();

            List<Long> ids = new ArrayList<>();
            for (Future<Long> result : results) {
                ids.add(result.get(30, TimeUnit.SECONDS));
            }
            assertThat(ids).hasSize(callers).containsOnly(ids.get(0));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A new conversation has both users as active participants and default settings")
    void newConversationHasBothParticipantsAndDefaults() {
        Conversation conversation = conversationStore.getOrCreateConversation("user-003", "user-008");

        assertThat(conversation.isActive()).isTrue();
        assertThat(conversation.isActiveParticipant("user-003")).isTrue();
        assertThat(conversation.isActiveParticipant("user-008")).isTrue();
        assertThat(conversation.getSettings().isAutoTranslate()).isTrue();
        assertThat(conversation.getSettings().isNotifications()).isTrue();
    }

    @Test
    @DisplayName("Self, unknown, deactivated and blocked peers are rejected")
    void rejectsInvalidPeers() {
        assertThatThrownBy(() -> conversationStore.getOrCreateConversation("user-001", "user-001"))
                .isInstanceOf(ValidationFailureException.class);
        assertThatThrownBy(() -> conversationStore.getOrCreateConversation("user-001", "nobody"))
                .isInstanceOf(ResourceNotFoundException.class);
        // user-010 is deactivated
        assertThatThrownBy(() -> conversationStore.getOrCreateConversation("user-001", "user-010"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> conversationStore.getOrCreateConversation("user-006", "user-005"))
                .isInstanceOf(AuthorizationFailureException.class);
    }

    @Test
    @DisplayName("Leaving releases the pair so the users can start over")
    void leaveReleasesPair() {
        Conversation first = conversationStore.getOrCreateConversation("user-004", "user-009");

        Conversation left = conversationStore.leaveConversation(first.getId(), "user-004");

        assertThat(left.isActiveParticipant("user-004")).isFalse();
        assertThat(left.isActive()).isTrue();
        assertThatThrownBy(() -> conversationStore.getForParticipant(first.getId(), "user-004"))
                .isInstanceOf(AuthorizationFailureException.class);

        Conversation second = conversationStore.getOrCreateConversation("user-009", "user-004");
        assertThat(second.getId()).isNotEqualTo(first.getId());
    }

    @Test
    @DisplayName("Settings updates only touch the given fields")
    void settingsUpdateOnlyTouchesGivenFields() {
        Conversation conversation = conversationStore.getOrCreateConversation("user-007", "user-008");

        Conversation updated = conversationStore.updateSettings(conversation.getId(), "user-007",
                SettingsUpdate.builder().muted(true).autoTranslate(false).build());

        assertThat(updated.getSettings().isAutoTranslate()).isFalse();
        assertThat(updated.getSettings().isNotifications()).isTrue();
        assertThat(updated.activeParticipant("user-007")).get().satisfies(p -> assertThat(p.isMuted()).isTrue());
        assertThat(updated.activeParticipant("user-008")).get().satisfies(p -> assertThat(p.isMuted()).isFalse());
    }

    @Test
    @DisplayName("The typing flag is only persisted when it changes")
    void typingFlagIsOnlyRewrittenOnChange() {
        Conversation conversation = conversationStore.getOrCreateConversation("user-002", "user-009");

        TypingChange stopWithoutStart = conversationStore.setTyping(conversation.getId(), "user-002", false);
        TypingChange start = conversationStore.setTyping(conversation.getId(), "user-002", true);
        TypingChange stop = conversationStore.setTyping(conversation.getId(), "user-002", false);

        assertThat(stopWithoutStart.persisted()).isFalse();
        assertThat(start.persisted()).isTrue();
        assertThat(start.recipients()).containsExactly("user-009");
        assertThat(stop.persisted()).isTrue();
        assertThat(stop.typing()).isFalse();
    }
}
