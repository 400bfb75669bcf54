package com.example.procloner.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for session events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SessionEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<SessionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the session's subscribers, then to the global ones.
     */
    public void publish(SessionEvent event) {
        log.debug("[CHANNEL] publish {} for session {}", event.getType().wireName(), event.getSessionId());

        if (event.getSessionId() != null) {
            List<Consumer<SessionEvent>> subs = sessionSubscribers.get(event.getSessionId());
            if (subs != null) {
                for (Consumer<SessionEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<SessionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one session.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(final String sessionId, final Consumer<SessionEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<Consumer<SessionEvent>>()).add(consumer);
        log.debug("[CHANNEL] subscribed to session {}", sessionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<SessionEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(final Consumer<SessionEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String sessionId) {
        List<Consumer<SessionEvent>> subs = sessionSubscribers.get(sessionId);
        return subs == null ? 0 : subs.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SessionEvent> subscriber, SessionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("[CHANNEL] subscriber failed on {}: {}", event.getType().wireName(), e.getMessage(), e);
        }
    }
}
