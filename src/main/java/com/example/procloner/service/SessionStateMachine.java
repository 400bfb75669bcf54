package com.example.procloner.service;

import com.example.procloner.event.EventBus;
import com.example.procloner.event.SessionEvent;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Sole writer of session lifecycle state.
 * <p>
 * Transitions follow a fixed table; anything else is rejected. Every mutation and the event
 * announcing it happen under the session's lock, so subscribers see states and progress in
 * the order they were applied. Progress never decreases, and terminal sessions accept no
 * further progress or asset events.
 */
@Service
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private static final Map<SessionStatus, Set<SessionStatus>> TRANSITIONS = new EnumMap<>(SessionStatus.class);

    static {
        TRANSITIONS.put(SessionStatus.STARTING, EnumSet.of(SessionStatus.CRAWLING,
                SessionStatus.ERROR, SessionStatus.TIMEOUT, SessionStatus.INTERRUPTED));
        TRANSITIONS.put(SessionStatus.CRAWLING, EnumSet.of(SessionStatus.PROCESSING,
                SessionStatus.ERROR, SessionStatus.TIMEOUT, SessionStatus.INTERRUPTED));
        TRANSITIONS.put(SessionStatus.PROCESSING, EnumSet.of(SessionStatus.COMPLETED,
                SessionStatus.ERROR, SessionStatus.TIMEOUT, SessionStatus.INTERRUPTED));
        TRANSITIONS.put(SessionStatus.INTERRUPTED, EnumSet.of(SessionStatus.RESUMING));
        // back to interrupted when the snapshot turns out to be unusable
        TRANSITIONS.put(SessionStatus.RESUMING, EnumSet.of(SessionStatus.CRAWLING,
                SessionStatus.INTERRUPTED, SessionStatus.ERROR, SessionStatus.TIMEOUT));
        TRANSITIONS.put(SessionStatus.COMPLETED, EnumSet.noneOf(SessionStatus.class));
        TRANSITIONS.put(SessionStatus.ERROR, EnumSet.noneOf(SessionStatus.class));
        TRANSITIONS.put(SessionStatus.TIMEOUT, EnumSet.noneOf(SessionStatus.class));
    }

    public static final int CRAWL_PHASE_WEIGHT = 90;

    private final SessionStore store;
    private final EventBus eventBus;

    public SessionStateMachine(SessionStore store, EventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    public static boolean isAllowed(SessionStatus from, SessionStatus to) {
        Set<SessionStatus> targets = TRANSITIONS.get(from);
        return targets != null && targets.contains(to);
    }

    public static Set<SessionStatus> allowedFrom(SessionStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public CloneSession create(String sessionId, String url, CloneOptions options, String outputDir) {
        CloneSession session = new CloneSession(sessionId, url, options);
        session.setOutputDir(outputDir);
        store.register(session);
        log.info("[SESSION] created {} for {}", session.getId(), url);
        eventBus.publish(SessionEvent.statusUpdate(session));
        return session;
    }

    /**
     * @throws IllegalSessionTransitionException when the table forbids the move
     */
    public CloneSession transition(String sessionId, final SessionStatus target, final String message) {
        return store.withSession(sessionId, new Function<CloneSession, CloneSession>() {
            public CloneSession apply(CloneSession s) {
                applyTransition(s, target, message);
                return s;
            }
        });
    }

    /**
     * Like {@link #transition} but reports a forbidden move instead of throwing. Used where a
     * concurrent stop may already have moved the session on.
     */
    public boolean tryTransition(String sessionId, final SessionStatus target, final String message) {
        return store.withSession(sessionId, new Function<CloneSession, Boolean>() {
            public Boolean apply(CloneSession s) {
                if (!isAllowed(s.getStatus(), target)) {
                    log.debug("[SESSION] {} ignoring {} -> {}", s.getId(), s.getStatus().value(), target.value());
                    return false;
                }
                applyTransition(s, target, message);
                return true;
            }
        });
    }

    public CloneSession startCrawling(String sessionId) {
        return store.withSession(sessionId, new Function<CloneSession, CloneSession>() {
            public CloneSession apply(CloneSession s) {
                s.setExecutionStartedAt(Instant.now());
                applyTransition(s, SessionStatus.CRAWLING, null);
                return s;
            }
        });
    }

    public boolean startProcessing(String sessionId) {
        return tryTransition(sessionId, SessionStatus.PROCESSING, null);
    }

    public boolean complete(String sessionId, final CloningResult result) {
        return store.withSession(sessionId, new Function<CloneSession, Boolean>() {
            public Boolean apply(CloneSession s) {
                if (!isAllowed(s.getStatus(), SessionStatus.COMPLETED)) return false;
                s.setProgress(100);
                s.setResult(result);
                applyTransition(s, SessionStatus.COMPLETED, null);
                return true;
            }
        });
    }

    public boolean fail(String sessionId, String message, CloningResult result) {
        return finish(sessionId, SessionStatus.ERROR, message, result);
    }

    public boolean timeout(String sessionId, String message, CloningResult result) {
        return finish(sessionId, SessionStatus.TIMEOUT, message, result);
    }

    public boolean interrupt(String sessionId, String message) {
        return tryTransition(sessionId, SessionStatus.INTERRUPTED, message);
    }

    /**
     * Interrupted to resuming. Progress and counts are kept.
     */
    public CloneSession beginResume(String sessionId) {
        return transition(sessionId, SessionStatus.RESUMING, null);
    }

    /**
     * Raises progress to {@code value} if that is higher than the current value. Ignored for
     * terminal sessions.
     *
     * @return whether an update was published
     */
    public boolean updateProgress(String sessionId, final int value, final int assetCount) {
        return store.withSession(sessionId, new Function<CloneSession, Boolean>() {
            public Boolean apply(CloneSession s) {
                if (s.getStatus().isTerminal()) return false;
                int clamped = Math.max(0, Math.min(100, value));
                boolean changed = false;
                if (clamped > s.getProgress()) {
                    s.setProgress(clamped);
                    changed = true;
                }
                if (assetCount > s.getAssetCount()) {
                    s.setAssetCount(assetCount);
                    changed = true;
                }
                if (changed) {
                    eventBus.publish(SessionEvent.progressUpdate(s.getId(), s.getProgress(), s.getAssetCount()));
                }
                return changed;
            }
        });
    }

    /**
     * Crawl-phase progress from settled versus discovered assets, scaled into the crawl share.
     */
    public static int crawlProgress(int settled, int discovered) {
        if (discovered <= 0) return 0;
        return (int) Math.min(CRAWL_PHASE_WEIGHT, (long) CRAWL_PHASE_WEIGHT * settled / discovered);
    }

    public boolean assetFound(String sessionId, final DiscoveredAsset asset) {
        return store.withSession(sessionId, new Function<CloneSession, Boolean>() {
            public Boolean apply(CloneSession s) {
                if (s.getStatus().isTerminal()) return false;
                eventBus.publish(SessionEvent.assetFound(s.getId(), asset));
                return true;
            }
        });
    }

    public void recordFingerprint(String sessionId, final BuildToolFingerprint fingerprint) {
        store.withSession(sessionId, new Function<CloneSession, Void>() {
            public Void apply(CloneSession s) {
                s.setFingerprint(fingerprint);
                store.persist(s);
                return null;
            }
        });
    }

    public void pagesVisited(String sessionId, final int pages) {
        store.withSession(sessionId, new Function<CloneSession, Void>() {
            public Void apply(CloneSession s) {
                if (pages > s.getPagesVisited()) s.setPagesVisited(pages);
                return null;
            }
        });
    }

    private boolean finish(String sessionId, final SessionStatus target, final String message,
                           final CloningResult result) {
        return store.withSession(sessionId, new Function<CloneSession, Boolean>() {
            public Boolean apply(CloneSession s) {
                if (!isAllowed(s.getStatus(), target)) return false;
                if (result != null) {
                    result.setError(message);
                    result.setSuccess(false);
                    s.setResult(result);
                }
                applyTransition(s, target, message);
                return true;
            }
        });
    }

    // caller holds the session lock
    private void applyTransition(CloneSession s, SessionStatus target, String message) {
        SessionStatus from = s.getStatus();
        if (!isAllowed(from, target)) {
            throw new IllegalSessionTransitionException(s.getId(), from, target);
        }
        s.setStatus(target);
        if (target == SessionStatus.ERROR || target == SessionStatus.TIMEOUT || target == SessionStatus.INTERRUPTED) {
            s.setError(message);
        } else if (target == SessionStatus.RESUMING || target == SessionStatus.CRAWLING) {
            s.setError(null);
        }
        if (target.isTerminal()) {
            s.setCompletedAt(Instant.now());
        }
        if (target == SessionStatus.INTERRUPTED) {
            s.setInterruptedAt(Instant.now());
        }
        if (target == SessionStatus.RESUMING) {
            s.setInterruptedAt(null);
        }
        log.info("[SESSION] {} {} -> {}{}", s.getId(), from.value(), target.value(),
                message == null ? "" : " (" + message + ")");
        store.persist(s);
        eventBus.publish(SessionEvent.statusUpdate(s));
    }
}
