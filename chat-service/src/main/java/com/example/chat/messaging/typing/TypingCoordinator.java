package com.example.chat.messaging.typing;

import com.example.chat.messaging.event.ChatEventPublisher;
import com.example.chat.messaging.event.FanoutResult;
import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.store.TypingChange;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.util.Constants.ChatEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Typing indicators. Flags are kept on the participant record and broadcast to the other
 * participants; a start that is not followed by a stop within the configured TTL is
 * cleared by a sweep.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TypingCoordinator {

    private final ConversationStore conversationStore;
    private final ChatEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final Clock clock;

    private Scheduler sweepScheduler;
    private Disposable sweepSubscription;

    @PostConstruct
    public void start() {
        AppProperties.Typing typing = appProperties.getTyping();
        if (typing.getTtlMs() <= 0) {
            log.info("Typing expiry disabled");
            return;
        }
        sweepScheduler = Schedulers.newSingle("typing-sweep");
        sweepSubscription = Flux.interval(Duration.ofMillis(typing.getSweepIntervalMs()), sweepScheduler)
                .subscribe(tick -> {
                    try {
                        expireStale(OffsetDateTime.now(clock));
                    } catch (RuntimeException e) {
                        log.error("Error in typing expiry sweep: {}", e.getMessage(), e);
                    }
                });
    }

    @PreDestroy
    public void stop() {
        if (sweepSubscription != null) {
            sweepSubscription.dispose();
        }
        if (sweepScheduler != null) {
            sweepScheduler.dispose();
        }
    }

    public FanoutResult setTyping(Long conversationId, String userId, boolean typing) {
        TypingChange change = conversationStore.setTyping(conversationId, userId, typing);
        if (!change.persisted()) {
            return FanoutResult.NONE;
        }
        return broadcast(change);
    }

    /**
     * Clears the flag and broadcasts a stop in every conversation the user is active in,
     * used when the user goes offline. The stop goes out even where no flag was stored, since
     * a peer may still show a start whose stop was lost.
     */
    public FanoutResult stopAll(String userId) {
        FanoutResult total = FanoutResult.NONE;
        for (Long conversationId : conversationStore.activeConversationIds(userId)) {
            total = total.plus(broadcast(conversationStore.setTyping(conversationId, userId, false)));
        }
        return total;
    }

    /**
     * Clears typing flags whose last start is older than the TTL.
     *
     * @return the cleared flags
     */
    public List<TypingChange> expireStale(OffsetDateTime now) {
        long ttlMs = appProperties.getTyping().getTtlMs();
        if (ttlMs <= 0) {
            return List.of();
        }
        OffsetDateTime cutoff = now.withOffsetSameInstant(ZoneOffset.UTC).minus(Duration.ofMillis(ttlMs));
        List<TypingChange> cleared = conversationStore.clearTypingStartedBefore(cutoff);
        cleared.forEach(this::broadcast);
        if (!cleared.isEmpty()) {
            log.debug("Expired {} typing flags older than {}", cleared.size(), cutoff);
        }
        return cleared;
    }

    private FanoutResult broadcast(TypingChange change) {
        return eventPublisher.fanOut(change.recipients(), ChatEventType.TYPING_STATUS,
                new TypingStatusPayload(change.conversationId(), change.userId(), change.typing()));
    }
}
