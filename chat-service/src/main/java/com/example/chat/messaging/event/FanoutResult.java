package com.example.chat.messaging.event;

/**
 * How many recipients had a live session and received a frame, and how many were skipped.
 */
public record FanoutResult(int delivered, int skipped) {

    public static final FanoutResult NONE = new FanoutResult(0, 0);

    public FanoutResult plus(FanoutResult other) {
        return new FanoutResult(delivered + other.delivered, skipped + other.skipped);
    }
}
