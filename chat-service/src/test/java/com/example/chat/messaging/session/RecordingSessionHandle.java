package com.example.chat.messaging.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Session handle that keeps every frame it is given.
 */
public class RecordingSessionHandle implements SessionHandle {

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;
    private volatile String closeReason;

    public RecordingSessionHandle(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean send(String frame) {
        if (!open || failing) {
            return false;
        }
        frames.add(frame);
        return true;
    }

    @Override
    public void close(String reason) {
        if (open) {
            open = false;
            closeReason = reason;
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void failSends() {
        failing = true;
    }

    public List<String> frames() {
        return frames;
    }

    public boolean received(String event) {
        return frames.stream().anyMatch(frame -> frame.startsWith("{\"event\":\"" + event + "\""));
    }

    public String lastFrame() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public String closeReason() {
        return closeReason;
    }
}
