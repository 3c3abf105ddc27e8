package com.example.chat.messaging.service;

import com.example.chat.messaging.store.MessageRemoval;
import com.example.chat.messaging.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Removes temporary messages once their expiry has passed and tells the participants.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemporaryMessageExpiryService {

    private final MessageStore messageStore;
    private final ChatService chatService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${chat.store.expiry-interval-ms:60000}")
    @SchedulerLock(name = "expireTemporaryMessages", lockAtMostFor = "PT59S")
    public void expireTemporaryMessages() {
        expireAt(OffsetDateTime.now(clock));
    }

    /**
     * @return number of messages removed in this pass
     */
    public int expireAt(OffsetDateTime now) {
        List<MessageRemoval> removals = messageStore.expireMessages(now);
        if (removals.isEmpty()) {
            log.debug("No temporary messages to expire.");
            return 0;
        }
        log.info("Expired {} temporary messages.", removals.size());
        for (MessageRemoval removal : removals) {
            try {
                chatService.announceRemoval(removal);
            } catch (RuntimeException e) {
                log.error("Error announcing removal of message {}: {}", removal.messageId(), e.getMessage(), e);
            }
        }
        return removals.size();
    }
}
