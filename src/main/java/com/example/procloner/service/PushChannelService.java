package com.example.procloner.service;

import com.example.procloner.event.ActivityHistory;
import com.example.procloner.event.EventBus;
import com.example.procloner.event.EventType;
import com.example.procloner.event.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} streams.
 * <p>
 * The first frame on every stream is {@code connection_status}. A stream opened for one
 * session replays that session's recent history and then follows it live; a stream opened
 * without a session receives every event. Heartbeat comments keep idle connections open
 * through proxies.
 */
@Service
public class PushChannelService {

    private static final Logger log = LoggerFactory.getLogger(PushChannelService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final ActivityHistory history;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactory() {
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "sse-heartbeat");
                    t.setDaemon(true);
                    return t;
                }
            });

    @Autowired
    public PushChannelService(EventBus eventBus, ActivityHistory history) {
        this(eventBus, history, DEFAULT_TIMEOUT_MS);
    }

    PushChannelService(EventBus eventBus, ActivityHistory history, long timeoutMs) {
        this.eventBus = eventBus;
        this.history = history;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(new Runnable() {
            public void run() {
                sendHeartbeats();
            }
        }, HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (EmitterRegistration registration : activeRegistrations) {
            registration.emitter.complete();
        }
    }

    /**
     * @param sessionId session to follow, or {@code null} for every session
     */
    public SseEmitter open(final String sessionId) {
        final SseEmitter emitter = new SseEmitter(timeoutMs);
        final String scope = sessionId == null ? "*" : sessionId;

        // history is read before subscribing; an event landing in between may arrive twice
        List<SessionEvent> backlog = sessionId == null
                ? Collections.<SessionEvent>emptyList()
                : history.recent(sessionId);

        EventBus.Subscription subscription = sessionId == null
                ? eventBus.subscribeAll(event -> send(emitter, event))
                : eventBus.subscribe(sessionId, event -> send(emitter, event));
        final EmitterRegistration registration = new EmitterRegistration(scope, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("[CHANNEL] stream timed out for {}", scope);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("[CHANNEL] stream error for {}: {}", scope, ex.getMessage());
            cleanup(registration);
        });

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("connected", true);
        status.put("replayed", backlog.size());
        send(emitter, new SessionEvent(sessionId, EventType.CONNECTION_STATUS, status));
        for (SessionEvent event : backlog) {
            send(emitter, event);
        }
        log.info("[CHANNEL] stream opened for {} (timeout={}ms)", scope, timeoutMs);
        return emitter;
    }

    public int activeStreamCount() {
        return activeRegistrations.size();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError cleans up
                log.debug("[CHANNEL] heartbeat failed for {}: {}", registration.scope, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("[CHANNEL] heartbeat skipped for {}, stream closed", registration.scope);
            }
        }
    }

    private void send(SseEmitter emitter, SessionEvent event) {
        try {
            synchronized (emitter) {
                emitter.send(SseEmitter.event()
                        .name(event.getType().wireName())
                        .data(event.toFrame()));
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("[CHANNEL] could not send {} for {}: {}", event.getType().wireName(),
                    event.getSessionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private static final class EmitterRegistration {
        final String scope;
        final SseEmitter emitter;
        final EventBus.Subscription subscription;

        EmitterRegistration(String scope, SseEmitter emitter, EventBus.Subscription subscription) {
            this.scope = scope;
            this.emitter = emitter;
            this.subscription = subscription;
        }
    }
}
