package com.example.chat.messaging.session;

/**
 * Published after the registry evicted a session on its own, either because it went idle
 * or because frames repeatedly failed to reach it.
 */
public record SessionExpiredEvent(String userId, SessionHandle handle, Reason reason) {

    public enum Reason {
        STALE,
        SEND_FAILURES
    }
}
