package com.example.chat.shared.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public final class Constants {

    private Constants() {}

    public static final String AUTO_LANGUAGE = "auto";
    public static final int MAX_TEXT_LENGTH = 10_000;
    public static final int WAVEFORM_POINTS = 100;
    public static final double FALLBACK_CONFIDENCE = 0.1;

    public enum MessageType {
        TEXT,
        VOICE,
        IMAGE,
        FILE,
        SYSTEM;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static MessageType fromValue(String value) {
            return value == null ? null : MessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Delivery state of a message. Moves forward only; {@code FAILED} can be reached from
     * any state that is not terminal.
     */
    public enum MessageStatus {
        SENDING,
        SENT,
        DELIVERED,
        READ,
        FAILED;

        private static final Set<MessageStatus> TERMINAL = EnumSet.of(READ, FAILED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        public boolean canTransitionTo(MessageStatus target) {
            if (target == null || isTerminal()) {
                return false;
            }
            if (target == FAILED) {
                return true;
            }
            return target.ordinal() > ordinal();
        }

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum PresenceStatus {
        ONLINE,
        AWAY,
        BUSY,
        OFFLINE;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static PresenceStatus fromValue(String value) {
            return value == null ? null : PresenceStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum ConnectionStatus {
        PENDING,
        ACCEPTED,
        BLOCKED
    }

    public enum TranscriptStatus {
        COMPLETED,
        UNAVAILABLE
    }

    /**
     * Event names carried in the {@code event} field of every real-time frame.
     */
    public enum ChatEventType {
        CONNECTED,
        HEARTBEAT,
        SERVER_SHUTDOWN,
        SESSION_REPLACED,
        ERROR,
        PONG,
        NEW_MESSAGE,
        MESSAGE_REACTION,
        MESSAGE_EDITED,
        MESSAGE_REMOVED,
        MESSAGES_READ,
        TYPING_STATUS,
        FRIEND_STATUS_CHANGED,
        CONVERSATION_JOINED,
        CONVERSATION_LEFT,
        SIGNAL_FAILED;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Inbound frame names understood by the connection gateway.
     */
    public enum InboundEventType {
        JOIN_CONVERSATION,
        LEAVE_CONVERSATION,
        TYPING_START,
        TYPING_STOP,
        REACTION_ADD,
        REACTION_REMOVE,
        UPDATE_STATUS,
        PING,
        VOICE_CALL_REQUEST,
        VOICE_CALL_ACCEPT,
        VOICE_CALL_DECLINE,
        VOICE_CALL_END,
        WEBRTC_OFFER,
        WEBRTC_ANSWER,
        WEBRTC_ICE_CANDIDATE;

        private static final Set<InboundEventType> SIGNALING = EnumSet.of(
                VOICE_CALL_REQUEST, VOICE_CALL_ACCEPT, VOICE_CALL_DECLINE, VOICE_CALL_END,
                WEBRTC_OFFER, WEBRTC_ANSWER, WEBRTC_ICE_CANDIDATE);

        public boolean isSignaling() {
            return SIGNALING.contains(this);
        }

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static InboundEventType fromWireName(String event) {
            if (event == null || event.isBlank()) {
                return null;
            }
            try {
                return InboundEventType.valueOf(event.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
    }
}
