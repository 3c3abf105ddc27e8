package com.example.chat.messaging.session;

import com.example.chat.messaging.event.ChatEventFactory;
import com.example.chat.shared.config.AppProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live session per user on this node. A new connection for a user replaces and closes
 * the previous one. A sweep evicts sessions that have been idle past the stale threshold
 * and announces each eviction as a {@link SessionExpiredEvent}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionRegistry {

    private final Map<String, Registration> sessions = new ConcurrentHashMap<>();

    private final ChatEventFactory eventFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final Clock clock;

    private Scheduler sweepScheduler;
    private Disposable sweepSubscription;
    private Disposable heartbeatSubscription;

    @PostConstruct
    public void start() {
        AppProperties.Session config = appProperties.getSession();
        sweepScheduler = Schedulers.newSingle("session-sweep");
        sweepSubscription = Flux.interval(Duration.ofMillis(config.getSweepIntervalMs()), sweepScheduler)
                .subscribe(tick -> runSafely("stale session sweep", () -> sweepStaleSessions(clock.instant())));
        heartbeatSubscription = Flux.interval(Duration.ofMillis(config.getHeartbeatIntervalMs()), sweepScheduler)
                .subscribe(tick -> runSafely("heartbeat", this::sendHeartbeats));
        log.info("Session registry started (sweep every {}ms, stale after {}ms, heartbeat every {}ms)",
                config.getSweepIntervalMs(), config.getStaleThresholdMs(), config.getHeartbeatIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Commencing session registry shutdown...");
        dispose(sweepSubscription);
        dispose(heartbeatSubscription);
        if (!sessions.isEmpty()) {
            log.info("Sending shutdown notice to {} connected clients...", sessions.size());
            String frame = eventFactory.createShutdownEvent();
            new ArrayList<>(sessions.values()).forEach(registration -> {
                if (frame != null) {
                    registration.handle.send(frame);
                }
                registration.handle.close("server shutdown");
            });
            sessions.clear();
        }
        if (sweepScheduler != null) {
            sweepScheduler.dispose();
        }
        log.info("Session registry shutdown complete.");
    }

    /**
     * Makes {@code handle} the user's current session.
     *
     * @return true if an earlier session was replaced
     */
    public boolean register(String userId, SessionHandle handle) {
        Registration previous = sessions.put(userId, new Registration(handle, clock.instant()));
        if (previous != null && previous.handle != handle) {
            log.info("User {} reconnected; replacing session {} with {}", userId, previous.handle.id(), handle.id());
            String frame = eventFactory.createSessionReplacedEvent();
            if (frame != null) {
                previous.handle.send(frame);
            }
            previous.handle.close("replaced by a newer connection");
            return true;
        }
        log.info("Registered session {} for user {}", handle.id(), userId);
        return false;
    }

    /**
     * Removes the user's registration only if {@code handle} is still the current one, so
     * a late close of a replaced connection cannot unregister its successor.
     *
     * @return true if this call removed the registration
     */
    public boolean deregister(String userId, SessionHandle handle) {
        AtomicReference<Registration> removed = new AtomicReference<>();
        sessions.computeIfPresent(userId, (key, current) -> {
            if (current.handle == handle) {
                removed.set(current);
                return null;
            }
            return current;
        });
        if (removed.get() != null) {
            log.info("Deregistered session {} for user {}", handle.id(), userId);
            return true;
        }
        return false;
    }

    public Optional<SessionHandle> lookup(String userId) {
        Registration registration = sessions.get(userId);
        return registration == null ? Optional.empty() : Optional.of(registration.handle);
    }

    public boolean isOnline(String userId) {
        return sessions.containsKey(userId);
    }

    public void touch(String userId) {
        Registration registration = sessions.get(userId);
        if (registration != null) {
            registration.lastActivity.set(clock.instant());
        }
    }

    /**
     * Queues a frame on the user's session. A session that fails too many sends in a row is
     * evicted.
     *
     * @return true if the frame was queued
     */
    public boolean send(String userId, String frame) {
        Registration registration = sessions.get(userId);
        if (registration == null) {
            return false;
        }
        if (registration.handle.send(frame)) {
            registration.failedEmits.set(0);
            return true;
        }
        int failures = registration.failedEmits.incrementAndGet();
        log.warn("Failed to emit frame for user {} on session {}. Fail count: {}", userId, registration.handle.id(), failures);
        if (failures >= appProperties.getSession().getMaxFailedEmits()) {
            log.warn("Session {} failed {} consecutive emits; evicting it", registration.handle.id(), failures);
            evict(userId, registration, SessionExpiredEvent.Reason.SEND_FAILURES);
        }
        return false;
    }

    /**
     * Evicts every session idle for longer than the stale threshold.
     *
     * @return ids of the users whose sessions were evicted
     */
    public List<String> sweepStaleSessions(Instant now) {
        Instant cutoff = now.minusMillis(appProperties.getSession().getStaleThresholdMs());
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, Registration> entry : new ArrayList<>(sessions.entrySet())) {
            Registration registration = entry.getValue();
            if (registration.lastActivity.get().isBefore(cutoff)
                    && evict(entry.getKey(), registration, SessionExpiredEvent.Reason.STALE)) {
                evicted.add(entry.getKey());
            }
        }
        if (!evicted.isEmpty()) {
            log.warn("Evicted {} stale sessions: {}", evicted.size(), evicted);
        }
        return evicted;
    }

    public int registeredCount() {
        return sessions.size();
    }

    public List<SessionInfo> snapshot() {
        List<SessionInfo> result = new ArrayList<>();
        sessions.forEach((userId, registration) -> result.add(toInfo(userId, registration)));
        return result;
    }

    public Optional<SessionInfo> describe(String userId) {
        Registration registration = sessions.get(userId);
        return registration == null ? Optional.empty() : Optional.of(toInfo(userId, registration));
    }

    private boolean evict(String userId, Registration registration, SessionExpiredEvent.Reason reason) {
        if (!sessions.remove(userId, registration)) {
            return false;
        }
        registration.handle.close(reason == SessionExpiredEvent.Reason.STALE ? "idle timeout" : "unreachable");
        eventPublisher.publishEvent(new SessionExpiredEvent(userId, registration.handle, reason));
        return true;
    }

    private void sendHeartbeats() {
        if (sessions.isEmpty()) {
            return;
        }
        String frame = eventFactory.createHeartbeatEvent();
        if (frame == null) {
            return;
        }
        for (String userId : new ArrayList<>(sessions.keySet())) {
            send(userId, frame);
        }
    }

    private static SessionInfo toInfo(String userId, Registration registration) {
        return new SessionInfo(userId, registration.handle.id(), registration.connectedAt, registration.lastActivity.get());
    }

    private static void runSafely(String task, Runnable work) {
        try {
            work.run();
        } catch (RuntimeException e) {
            // keep the interval alive
            log.error("Error in {} task: {}", task, e.getMessage(), e);
        }
    }

    private static void dispose(Disposable disposable) {
        if (disposable != null && !disposable.isDisposed()) {
            disposable.dispose();
        }
    }

    private static final class Registration {
        private final SessionHandle handle;
        private final Instant connectedAt;
        private final AtomicReference<Instant> lastActivity;
        private final AtomicInteger failedEmits = new AtomicInteger();

        private Registration(SessionHandle handle, Instant connectedAt) {
            this.handle = handle;
            this.connectedAt = connectedAt;
            this.lastActivity = new AtomicReference<>(connectedAt);
        }
    }
}
