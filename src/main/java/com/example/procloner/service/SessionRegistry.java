package com.example.procloner.service;

import com.example.procloner.config.SessionProperties;
import com.example.procloner.model.BuildTool;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.CloneSessionEntity;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.SessionStatus;
import com.example.procloner.repo.CloneSessionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory session registry with write-through snapshots to the database. Each session's
 * own monitor serialises mutations on it; different sessions never contend.
 * <p>
 * On startup, persisted sessions come back. Any that were still running when the previous
 * process died are marked interrupted so a client can resume them.
 */
@Component
public class SessionRegistry implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    static final String RESTART_MESSAGE = "Session interrupted by server restart";

    private final CloneSessionRepository repo;
    private final SessionProperties properties;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, CloneSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(CloneSessionRepository repo, SessionProperties properties, ObjectMapper objectMapper) {
        this.repo = repo;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void restore() {
        Instant now = Instant.now();
        int restored = 0;
        int interrupted = 0;
        for (CloneSessionEntity entity : repo.findAll()) {
            CloneSession session;
            try {
                session = fromEntity(entity);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("[SESSION] dropping unreadable snapshot {}: {}", entity.getSessionId(), e.getMessage());
                repo.delete(entity);
                continue;
            }
            if (!session.getStatus().isTerminal() && session.getStatus() != SessionStatus.INTERRUPTED) {
                session.setStatus(SessionStatus.INTERRUPTED);
                session.setError(RESTART_MESSAGE);
                session.setInterruptedAt(now);
                interrupted++;
            }
            if (session.isRetentionExpired(properties.getRetention(), now)) {
                repo.delete(entity);
                continue;
            }
            sessions.put(session.getId(), session);
            persist(session);
            restored++;
        }
        if (restored > 0) {
            log.info("[SESSION] restored {} sessions ({} interrupted by restart)", restored, interrupted);
        }
    }

    @Override
    public void register(CloneSession session) {
        if (sessions.putIfAbsent(session.getId(), session) != null) {
            throw new IllegalArgumentException("Duplicate session id " + session.getId());
        }
        persist(session);
    }

    @Override
    public CloneSession find(String sessionId) {
        return sessionId == null ? null : sessions.get(sessionId);
    }

    @Override
    public CloneSession require(String sessionId) {
        CloneSession s = find(sessionId);
        if (s == null) throw new SessionNotFoundException(sessionId);
        return s;
    }

    @Override
    public Collection<CloneSession> list() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    @Override
    public <T> T withSession(String sessionId, Function<CloneSession, T> action) {
        CloneSession session = require(sessionId);
        synchronized (session) {
            return action.apply(session);
        }
    }

    @Override
    public void persist(CloneSession session) {
        try {
            repo.save(toEntity(session));
        } catch (DataAccessException | JsonProcessingException e) {
            // the in-memory copy stays authoritative; the next snapshot retries
            log.warn("[SESSION] snapshot of {} failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean remove(String sessionId) {
        CloneSession removed = sessions.remove(sessionId);
        if (repo.existsById(sessionId)) {
            repo.deleteById(sessionId);
        }
        return removed != null;
    }

    @Override
    public List<String> evictExpired(Instant now) {
        List<String> evicted = new ArrayList<>();
        for (CloneSession session : sessions.values()) {
            if (session.isRetentionExpired(properties.getRetention(), now)) {
                remove(session.getId());
                evicted.add(session.getId());
            }
        }
        return evicted;
    }

    @Override
    public boolean canRecover(CloneSession session) {
        if (session == null || session.getStatus() != SessionStatus.INTERRUPTED) return false;
        if (session.isRetentionExpired(properties.getRetention(), Instant.now())) return false;
        return session.getOutputDir() != null && Files.isDirectory(Paths.get(session.getOutputDir()));
    }

    CloneSessionEntity toEntity(CloneSession s) throws JsonProcessingException {
        CloneSessionEntity e = new CloneSessionEntity();
        e.setSessionId(s.getId());
        e.setStatus(s.getStatus().value());
        e.setSourceUrl(s.getUrl());
        e.setOptionsJson(objectMapper.writeValueAsString(s.getOptions()));
        e.setProgress(s.getProgress());
        e.setAssetCount(s.getAssetCount());
        e.setPagesVisited(s.getPagesVisited());
        e.setOutputDir(s.getOutputDir());
        BuildToolFingerprint fp = s.getFingerprint();
        if (fp != null) {
            e.setBuildTool(fp.getTool().value());
            e.setBuildToolConfidence(fp.getConfidence());
        }
        e.setStartTime(s.getStartTime());
        e.setCompletedAt(s.getCompletedAt());
        e.setInterruptedAt(s.getInterruptedAt());
        e.setErrorMessage(s.getError());
        if (s.getResult() != null) {
            e.setResultJson(objectMapper.writeValueAsString(s.getResult()));
        }
        return e;
    }

    CloneSession fromEntity(CloneSessionEntity e) throws IOException {
        CloneOptions options = e.getOptionsJson() == null
                ? new CloneOptions()
                : objectMapper.readValue(e.getOptionsJson(), CloneOptions.class);
        CloneSession s = new CloneSession(e.getSessionId(), e.getSourceUrl(), options);
        s.setStatus(SessionStatus.fromValue(e.getStatus()));
        s.setProgress(e.getProgress() == null ? 0 : e.getProgress());
        s.setAssetCount(e.getAssetCount() == null ? 0 : e.getAssetCount());
        s.setPagesVisited(e.getPagesVisited() == null ? 0 : e.getPagesVisited());
        s.setOutputDir(e.getOutputDir());
        if (e.getBuildTool() != null) {
            s.setFingerprint(new BuildToolFingerprint(BuildTool.fromValue(e.getBuildTool()),
                    e.getBuildToolConfidence() == null ? 0.0 : e.getBuildToolConfidence(), null));
        }
        if (e.getStartTime() != null) s.setStartTime(e.getStartTime());
        s.setCompletedAt(e.getCompletedAt());
        s.setInterruptedAt(e.getInterruptedAt());
        s.setError(e.getErrorMessage());
        if (e.getResultJson() != null) {
            s.setResult(objectMapper.readValue(e.getResultJson(), CloningResult.class));
        }
        return s;
    }
}
