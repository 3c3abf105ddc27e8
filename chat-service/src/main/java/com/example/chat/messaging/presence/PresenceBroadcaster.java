package com.example.chat.messaging.presence;

import com.example.chat.messaging.directory.DirectoryService;
import com.example.chat.messaging.event.ChatEventPublisher;
import com.example.chat.messaging.event.FanoutResult;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.util.Constants.ChatEventType;
import com.example.chat.shared.util.Constants.PresenceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Records a user's presence in the directory, then tells the user's accepted connections
 * that are currently connected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("presence")
public class PresenceBroadcaster {

    private final DirectoryService directoryService;
    private final ChatEventPublisher eventPublisher;
    private final Clock clock;

    public FanoutResult transition(String userId, PresenceStatus status) {
        if (status == null) {
            throw new ValidationFailureException("Presence status is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
        directoryService.updatePresence(userId, status, now);
        List<String> friends = directoryService.acceptedConnections(userId);
        FanoutResult result = eventPublisher.fanOut(friends, ChatEventType.FRIEND_STATUS_CHANGED,
                new FriendStatusPayload(userId, status, now));
        log.info("User {} is now {} ({} friends notified, {} offline)", userId, status.getValue(),
                result.delivered(), result.skipped());
        return result;
    }
}
