package com.example.procloner.service;

import com.example.procloner.model.CloneSession;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Process-wide registry of sessions keyed by id. {@link #withSession} runs a read-modify-write
 * atomically with respect to every other call for the same id.
 */
public interface SessionStore {

    void register(CloneSession session);

    CloneSession find(String sessionId);

    /**
     * @throws SessionNotFoundException for unknown or evicted ids
     */
    CloneSession require(String sessionId);

    Collection<CloneSession> list();

    <T> T withSession(String sessionId, Function<CloneSession, T> action);

    /**
     * Writes the session's snapshot to durable storage.
     */
    void persist(CloneSession session);

    boolean remove(String sessionId);

    /**
     * Removes sessions whose terminal or interrupted time is older than the retention window.
     *
     * @return the evicted ids
     */
    List<String> evictExpired(Instant now);

    /**
     * Interrupted, still inside the retention window, and its output root still exists.
     */
    boolean canRecover(CloneSession session);
}
