package com.example.chat.messaging.event;

import com.example.chat.messaging.session.SessionRegistry;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.util.Constants.ChatEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Best-effort delivery of real-time frames to users with a registered session. Offline
 * recipients are counted as skipped; nothing is queued for them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatEventPublisher {

    private final SessionRegistry sessionRegistry;
    private final ChatEventFactory eventFactory;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    public FanoutResult fanOut(Collection<String> userIds, ChatEventType eventType, Object data) {
        if (userIds == null || userIds.isEmpty()) {
            return FanoutResult.NONE;
        }
        String frame = eventFactory.createEvent(eventType, data);
        if (frame == null) {
            return new FanoutResult(0, userIds.size());
        }
        return fanOutFrame(userIds, frame, eventType.wireName());
    }

    public boolean sendTo(String userId, ChatEventType eventType, Object data) {
        String frame = eventFactory.createEvent(eventType, data);
        return frame != null && fanOutFrame(List.of(userId), frame, eventType.wireName()).delivered() > 0;
    }

    /**
     * Sends an already serialized frame, used for relayed signaling whose event name is
     * chosen by the client.
     */
    public boolean sendFrame(String userId, String frame, String eventName) {
        return frame != null && fanOutFrame(List.of(userId), frame, eventName).delivered() > 0;
    }

    private FanoutResult fanOutFrame(Collection<String> userIds, String frame, String eventName) {
        int delivered = 0;
        int skipped = 0;
        for (String userId : userIds) {
            if (sessionRegistry.send(userId, frame)) {
                delivered++;
            } else {
                skipped++;
            }
        }
        if (delivered > 0) {
            metricsCollector.incrementCounter("chat.fanout.events", delivered, "result", "delivered");
        }
        if (skipped > 0) {
            metricsCollector.incrementCounter("chat.fanout.events", skipped, "result", "skipped");
        }
        log.debug("Event {} fanned out: {} delivered, {} skipped", eventName, delivered, skipped);
        return new FanoutResult(delivered, skipped);
    }
}
