package com.example.chat.messaging.event;

import com.example.chat.shared.util.Constants.ChatEventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes real-time frames as {@code {"event": name, "data": payload}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatEventFactory {

    private final ObjectMapper objectMapper;

    /**
     * @return the JSON frame, or null if the payload could not be serialized
     */
    public String createEvent(ChatEventType eventType, Object data) {
        return createFrame(eventType.wireName(), data);
    }

    public String createFrame(String eventName, Object data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", eventName);
        envelope.put("data", data == null ? Map.of() : data);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for event {}: {}", eventName, e.getMessage());
            return null;
        }
    }

    public String createConnectedEvent(String userId, String sessionId) {
        return createEvent(ChatEventType.CONNECTED, Map.of(
                "userId", userId,
                "sessionId", sessionId,
                "timestamp", now()));
    }

    public String createHeartbeatEvent() {
        return createEvent(ChatEventType.HEARTBEAT, Map.of("timestamp", now()));
    }

    public String createShutdownEvent() {
        return createEvent(ChatEventType.SERVER_SHUTDOWN,
                Map.of("message", "Server is shutting down. Please reconnect momentarily."));
    }

    public String createSessionReplacedEvent() {
        return createEvent(ChatEventType.SESSION_REPLACED,
                Map.of("message", "A newer connection for this user took over."));
    }

    public String createErrorEvent(String code, String message, Long retryAfterMs) {
        return createEvent(ChatEventType.ERROR, new ErrorPayload(code, message, retryAfterMs));
    }

    private static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC).toString();
    }
}
