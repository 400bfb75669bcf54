package com.example.procloner.service;

import com.example.procloner.event.ActivityHistory;
import com.example.procloner.event.ChannelReply;
import com.example.procloner.event.EventBus;
import com.example.procloner.event.EventType;
import com.example.procloner.event.SessionEvent;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers recover, resume, pause and cancel requests arriving over the push channel. Every
 * reply is also published on the session's stream.
 * <p>
 * Unknown and evicted ids always get {@code session_not_found}. A live session is reattached
 * with its current status and recent history; an interrupted one is offered for recovery.
 */
@Service
public class RecoveryProtocolHandler {

    private static final Logger log = LoggerFactory.getLogger(RecoveryProtocolHandler.class);

    static final String NOT_FOUND_MESSAGE = "Session not found or expired";
    static final String NOT_RUNNING_MESSAGE = "Session has no running crawl";

    private final SessionStore store;
    private final CloneSessionManager manager;
    private final ActivityHistory history;
    private final EventBus eventBus;

    public RecoveryProtocolHandler(SessionStore store, CloneSessionManager manager,
                                   ActivityHistory history, EventBus eventBus) {
        this.store = store;
        this.manager = manager;
        this.history = history;
        this.eventBus = eventBus;
    }

    public ChannelReply recover(String sessionId) {
        CloneSession session = store.find(sessionId);
        if (session == null) {
            log.info("[RECOVERY] recover {} -> not found", sessionId);
            return reply(notFound(sessionId));
        }
        SessionStatus status = session.getStatus();
        if (status == SessionStatus.INTERRUPTED) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("progress", session.getProgress());
            p.put("url", session.getUrl());
            p.put("totalAssets", session.getAssetCount());
            p.put("pagesVisited", session.getPagesVisited());
            p.put("canRecover", store.canRecover(session));
            if (session.getError() != null) p.put("error", session.getError());
            log.info("[RECOVERY] recover {} -> recovery available at {}%", sessionId, session.getProgress());
            return reply(new SessionEvent(sessionId, EventType.SESSION_RECOVERY_AVAILABLE, p));
        }
        Map<String, Object> p = new LinkedHashMap<>(SessionEvent.statusUpdate(session).getPayload());
        p.put("reattached", status.isActive());
        log.info("[RECOVERY] recover {} -> {} ({})", sessionId, status.value(),
                status.isActive() ? "reattached" : "finished");
        return reply(new ChannelReply(new SessionEvent(sessionId, EventType.STATUS_UPDATE, p),
                history.recent(sessionId)));
    }

    public ChannelReply resume(String sessionId) {
        try {
            CloneSession session = manager.resume(sessionId);
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("status", session.getStatus().value());
            p.put("progress", session.getProgress());
            p.put("totalAssets", session.getAssetCount());
            p.put("url", session.getUrl());
            return reply(new SessionEvent(sessionId, EventType.SESSION_RESUMED, p));
        } catch (SessionNotFoundException e) {
            return reply(notFound(sessionId));
        } catch (ResumeFailedException e) {
            log.info("[RECOVERY] resume {} failed: {}", sessionId, e.getMessage());
            return reply(SessionEvent.withMessage(sessionId, EventType.SESSION_RESUME_FAILED, "reason", e.getMessage()));
        }
    }

    public ChannelReply pause(String sessionId) {
        CloneSession session = store.find(sessionId);
        if (session == null) return reply(notFound(sessionId));
        if (!manager.pause(sessionId)) return reply(rejected(sessionId, NOT_RUNNING_MESSAGE));
        log.info("[RECOVERY] pause requested for {}", sessionId);
        return reply(acknowledged(session, "pause"));
    }

    public ChannelReply cancel(String sessionId) {
        CloneSession session = store.find(sessionId);
        if (session == null) return reply(notFound(sessionId));
        if (!manager.cancel(sessionId)) return reply(rejected(sessionId, NOT_RUNNING_MESSAGE));
        log.info("[RECOVERY] cancel requested for {}", sessionId);
        return reply(acknowledged(session, "cancel"));
    }

    static SessionEvent rejected(String sessionId, String reason) {
        return SessionEvent.withMessage(sessionId, EventType.REQUEST_REJECTED, "reason", reason);
    }

    private static SessionEvent notFound(String sessionId) {
        return SessionEvent.withMessage(sessionId, EventType.SESSION_NOT_FOUND, "message", NOT_FOUND_MESSAGE);
    }

    private static SessionEvent acknowledged(CloneSession session, String request) {
        Map<String, Object> p = new LinkedHashMap<>(SessionEvent.statusUpdate(session).getPayload());
        p.put("requested", request);
        return new SessionEvent(session.getId(), EventType.STATUS_UPDATE, p);
    }

    private ChannelReply reply(SessionEvent event) {
        return reply(ChannelReply.of(event));
    }

    private ChannelReply reply(ChannelReply reply) {
        eventBus.publish(reply.getReply());
        return reply;
    }
}
