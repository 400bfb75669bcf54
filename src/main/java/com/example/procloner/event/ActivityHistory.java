package com.example.procloner.event;

import com.example.procloner.config.SessionProperties;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the most recent events of each session so a reattaching client can replay them.
 */
@Component
public class ActivityHistory {

    private final EventBus eventBus;
    private final int capacity;
    private final ConcurrentHashMap<String, Deque<SessionEvent>> history = new ConcurrentHashMap<>();
    private EventBus.Subscription subscription;

    public ActivityHistory(EventBus eventBus, SessionProperties properties) {
        this.eventBus = eventBus;
        this.capacity = Math.max(1, properties.getHistorySize());
    }

    @PostConstruct
    public void init() {
        subscription = eventBus.subscribeAll(this::record);
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) subscription.unsubscribe();
    }

    void record(SessionEvent event) {
        if (event.getSessionId() == null || event.getType().isReplyOnly()) return;
        Deque<SessionEvent> events = history.computeIfAbsent(event.getSessionId(), k -> new ArrayDeque<SessionEvent>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > capacity) {
                events.removeFirst();
            }
        }
    }

    public List<SessionEvent> recent(String sessionId) {
        Deque<SessionEvent> events = history.get(sessionId);
        if (events == null) return Collections.emptyList();
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public void forget(String sessionId) {
        history.remove(sessionId);
    }
}
