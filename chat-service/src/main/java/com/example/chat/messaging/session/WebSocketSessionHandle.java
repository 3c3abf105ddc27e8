package com.example.chat.messaging.session;

import org.springframework.web.reactive.socket.CloseStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session handle over a WebSocket connection. Frames are buffered in a unicast sink that
 * the socket's outbound stream drains.
 */
public class WebSocketSessionHandle implements SessionHandle {

    // RFC 6455 limits the close reason to 123 bytes
    private static final int MAX_REASON_LENGTH = 120;

    private final String id;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private volatile CloseStatus closeStatus = CloseStatus.NORMAL;

    public WebSocketSessionHandle(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized boolean send(String frame) {
        if (!open.get() || frame == null) {
            return false;
        }
        return sink.tryEmitNext(frame).isSuccess();
    }

    @Override
    public void close(String reason) {
        closeWith(CloseStatus.NORMAL, reason);
    }

    public void closeWith(CloseStatus status, String reason) {
        if (open.compareAndSet(true, false)) {
            String trimmed = reason == null ? "" : reason.substring(0, Math.min(reason.length(), MAX_REASON_LENGTH));
            closeStatus = status.withReason(trimmed);
            synchronized (this) {
                sink.tryEmitComplete();
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    public Flux<String> outbound() {
        return sink.asFlux();
    }

    public CloseStatus closeStatus() {
        return closeStatus;
    }
}
