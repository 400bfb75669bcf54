package com.example.procloner.service;

import com.example.procloner.config.CrawlProperties;
import com.example.procloner.config.SessionProperties;
import com.example.procloner.config.StorageProperties;
import com.example.procloner.event.ActivityHistory;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloneRequest;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.CrawlState;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Starts, resumes, pauses and cancels clone sessions. Each running session has exactly one
 * driver task that owns its {@link CrawlExecution} and reports the outcome to the
 * {@link SessionStateMachine}.
 */
@Service
public class CloneSessionManager {

    private static final Logger log = LoggerFactory.getLogger(CloneSessionManager.class);

    static final String CANCEL_MESSAGE = "Session cancelled by client";
    static final String PAUSE_MESSAGE = "Session paused by client";
    static final String SHUTDOWN_MESSAGE = "Session interrupted by server shutdown";

    private final SessionStateMachine machine;
    private final SessionStore store;
    private final CrawlEngine engine;
    private final PostProcessor postProcessor;
    private final CheckpointStore checkpoints;
    private final ActivityHistory history;
    private final StorageProperties storage;
    private final CrawlProperties crawlProperties;
    private final SessionProperties sessionProperties;

    private final ConcurrentHashMap<String, CrawlExecution> executions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Future<?>> futures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> interruptMessages = new ConcurrentHashMap<>();
    private final Semaphore slots;
    private ExecutorService drivers;
    private ScheduledExecutorService evictor;

    public CloneSessionManager(SessionStateMachine machine,
                               SessionStore store,
                               CrawlEngine engine,
                               PostProcessor postProcessor,
                               CheckpointStore checkpoints,
                               ActivityHistory history,
                               StorageProperties storage,
                               CrawlProperties crawlProperties,
                               SessionProperties sessionProperties) {
        this.machine = machine;
        this.store = store;
        this.engine = engine;
        this.postProcessor = postProcessor;
        this.checkpoints = checkpoints;
        this.history = history;
        this.storage = storage;
        this.crawlProperties = crawlProperties;
        this.sessionProperties = sessionProperties;
        this.slots = new Semaphore(Math.max(1, sessionProperties.getMaxConcurrentSessions()));
    }

    @PostConstruct
    public void init() {
        int threads = Math.max(1, sessionProperties.getMaxConcurrentSessions());
        this.drivers = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<Runnable>(),
                namedDaemon("clone-session-"));
        this.evictor = Executors.newSingleThreadScheduledExecutor(namedDaemon("session-evictor-"));
        long every = Math.max(1000L, sessionProperties.getEvictionInterval().toMillis());
        evictor.scheduleAtFixedRate(new Runnable() {
            public void run() {
                evictExpired();
            }
        }, every, every, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        for (String id : new ArrayList<>(executions.keySet())) {
            interruptMessages.put(id, SHUTDOWN_MESSAGE);
            CrawlExecution exec = executions.get(id);
            if (exec != null) exec.stop(CrawlExecution.StopReason.PAUSED);
        }
        if (evictor != null) evictor.shutdownNow();
        if (drivers != null) {
            drivers.shutdown();
            try {
                if (!drivers.awaitTermination(10, TimeUnit.SECONDS)) {
                    drivers.shutdownNow();
                }
            } catch (InterruptedException e) {
                drivers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Registers a new session and starts crawling it in the background.
     *
     * @throws SessionCapacityExceededException when the running-session cap is reached
     */
    public CloneSession start(CloneRequest request) {
        CloneOptions options = request.getOptions();
        options.setDepth(crawlProperties.effectiveDepth(options.getDepth()));
        if (!slots.tryAcquire()) {
            throw new SessionCapacityExceededException(sessionProperties.getMaxConcurrentSessions());
        }
        String id = UUID.randomUUID().toString();
        Path root = storage.sessionRoot(id);
        CloneSession session;
        try {
            session = machine.create(id, request.getUrl(), options, root.toString());
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
        CrawlState state = new CrawlState(request.getUrl(), options.getDepth());
        session.setCrawlState(state);
        launch(session, state, false);
        return session;
    }

    /**
     * Continues an interrupted session from its last recorded state.
     *
     * @throws SessionNotFoundException for unknown or evicted ids
     * @throws ResumeFailedException    when the session cannot be resumed
     */
    public CloneSession resume(String sessionId) {
        CloneSession session = store.require(sessionId);
        if (executions.containsKey(sessionId)) {
            throw new ResumeFailedException(sessionId, "Session already has a running crawl");
        }
        if (session.getStatus() != SessionStatus.INTERRUPTED) {
            throw new ResumeFailedException(sessionId, "Session is " + session.getStatus().value() + ", not interrupted");
        }
        if (!store.canRecover(session)) {
            throw new ResumeFailedException(sessionId, "Session output is no longer available");
        }
        if (!slots.tryAcquire()) {
            throw new ResumeFailedException(sessionId, "Server is at capacity, try again later");
        }
        try {
            machine.beginResume(sessionId);
        } catch (IllegalSessionTransitionException e) {
            slots.release();
            throw new ResumeFailedException(sessionId, "Session is already being resumed");
        }
        CrawlState state = restoreState(session);
        session.setCrawlState(state);
        try {
            launch(session, state, true);
        } catch (RuntimeException e) {
            machine.interrupt(sessionId, "Resume failed: " + e.getMessage());
            throw new ResumeFailedException(sessionId, e.getMessage());
        }
        log.info("[RECOVERY] session={} resumed at {}% with {} known assets", sessionId,
                session.getProgress(), state.getAssets().size());
        return session;
    }

    /**
     * @return false when the session has no running crawl
     */
    public boolean pause(String sessionId) {
        CrawlExecution exec = executions.get(sessionId);
        if (exec == null) return false;
        interruptMessages.putIfAbsent(sessionId, PAUSE_MESSAGE);
        exec.stop(CrawlExecution.StopReason.PAUSED);
        return true;
    }

    /**
     * @return false when the session has no running crawl
     */
    public boolean cancel(String sessionId) {
        CrawlExecution exec = executions.get(sessionId);
        if (exec == null) return false;
        exec.stop(CrawlExecution.StopReason.CANCELLED);
        return true;
    }

    /**
     * Stops any running crawl and forgets the session. Files already written stay on disk.
     */
    public boolean remove(String sessionId) {
        store.require(sessionId);
        cancel(sessionId);
        history.forget(sessionId);
        return store.remove(sessionId);
    }

    public boolean isRunning(String sessionId) {
        return executions.containsKey(sessionId);
    }

    void evictExpired() {
        try {
            List<String> evicted = store.evictExpired(Instant.now());
            for (String id : evicted) {
                history.forget(id);
            }
            if (!evicted.isEmpty()) {
                log.info("[SESSION] evicted {} expired sessions", evicted.size());
            }
        } catch (RuntimeException e) {
            log.warn("[SESSION] eviction sweep failed: {}", e.getMessage());
        }
    }

    private CrawlState restoreState(CloneSession session) {
        CrawlState state = session.getCrawlState();
        if (state != null && state.hasPartialResults()) return state;
        Path root = Paths.get(session.getOutputDir());
        try {
            state = checkpoints.read(root);
        } catch (IOException e) {
            log.warn("[RECOVERY] session={} unreadable checkpoint: {}", session.getId(), e.getMessage());
        }
        if (state != null && state.hasPartialResults()) return state;
        log.info("[RECOVERY] session={} has no crawl state, discovering again from the root", session.getId());
        int depth = crawlProperties.effectiveDepth(session.getOptions().getDepth());
        return new CrawlState(session.getUrl(), depth);
    }

    // caller holds a slot; it is released when the driver finishes or launch fails
    private void launch(final CloneSession session, final CrawlState state, final boolean resumed) {
        final String id = session.getId();
        final Path root = Paths.get(session.getOutputDir());
        Instant deadline = Instant.now().plus(sessionProperties.getTimeout());
        final CrawlExecution exec = engine.newExecution(id, state, root, session.getOptions(), deadline,
                new SessionCrawlListener(id, state, root));
        if (executions.putIfAbsent(id, exec) != null) {
            slots.release();
            throw new IllegalStateException("Session " + id + " already has a running crawl");
        }
        try {
            Future<?> f = drivers.submit(new Runnable() {
                public void run() {
                    try {
                        drive(session, exec, root, resumed);
                    } finally {
                        futures.remove(id);
                        interruptMessages.remove(id);
                        slots.release();
                        // last, so a session that no longer reports running has freed its slot
                        executions.remove(id, exec);
                    }
                }
            });
            futures.put(id, f);
        } catch (RuntimeException e) {
            executions.remove(id, exec);
            slots.release();
            throw e;
        }
    }

    void drive(CloneSession session, CrawlExecution exec, Path root, boolean resumed) {
        final String id = session.getId();
        CloningResult result = null;
        try {
            try {
                machine.startCrawling(id);
            } catch (IllegalSessionTransitionException e) {
                log.info("[SESSION] {} stopped before crawling began ({})", id, session.getStatus().value());
                return;
            }
            result = exec.run();
            switch (exec.getStopReason()) {
                case CANCELLED:
                    machine.fail(id, CANCEL_MESSAGE, result);
                    return;
                case PAUSED:
                    checkpoint(id, root, exec.getState());
                    String message = interruptMessages.get(id);
                    machine.interrupt(id, message == null ? PAUSE_MESSAGE : message);
                    return;
                case TIMED_OUT:
                    checkpoint(id, root, exec.getState());
                    machine.timeout(id, timeoutMessage(), result);
                    return;
                default:
                    break;
            }
            if (!machine.startProcessing(id)) return;
            final int assets = exec.getState().getAssets().size();
            postProcessor.process(id, session.getUrl(), exec.getState(), session.getOptions(), root,
                    exec.getDeadline(), new IntConsumer() {
                        public void accept(int value) {
                            machine.updateProgress(id, value, assets);
                        }
                    });
            checkpoint(id, root, exec.getState());
            result.setSuccess(true);
            machine.complete(id, result);
        } catch (PageFetchException e) {
            log.warn("[SESSION] {} page-level failure: {}", id, e.getMessage());
            machine.fail(id, e.getMessage(), CloningResult.failure(id, e.getMessage()));
        } catch (SessionTimeoutException e) {
            log.warn("[SESSION] {} {}", id, e.getMessage());
            checkpoint(id, root, exec.getState());
            machine.timeout(id, timeoutMessage(), result != null ? result : CloningResult.failure(id, timeoutMessage()));
        } catch (IOException e) {
            log.error("[SESSION] {} I/O failure: {}", id, e.getMessage(), e);
            machine.fail(id, "I/O failure: " + e.getMessage(), CloningResult.failure(id, e.getMessage()));
        } catch (SessionNotFoundException e) {
            log.info("[SESSION] {} removed while running", id);
        } catch (RuntimeException e) {
            log.error("[SESSION] {} unexpected failure", id, e);
            String message = "Unexpected error: " + e.getMessage();
            machine.fail(id, message, CloningResult.failure(id, message));
        }
    }

    private String timeoutMessage() {
        return "Session exceeded time limit of " + sessionProperties.getTimeout().getSeconds() + "s";
    }

    private void checkpoint(String sessionId, Path root, CrawlState state) {
        if (!Files.isDirectory(root)) return;
        try {
            checkpoints.write(root, state);
        } catch (IOException e) {
            log.warn("[SESSION] {} checkpoint failed: {}", sessionId, e.getMessage());
        }
    }

    private static ThreadFactory namedDaemon(final String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory df = Executors.defaultThreadFactory();
            public Thread newThread(Runnable r) {
                Thread t = df.newThread(r);
                t.setName(prefix + t.getId());
                t.setDaemon(true);
                return t;
            }
        };
    }

    /**
     * Feeds crawl callbacks into the state machine and writes a checkpoint every few settled
     * assets.
     */
    private final class SessionCrawlListener implements CrawlListener {

        private final String sessionId;
        private final CrawlState state;
        private final Path root;
        private final AtomicInteger settled = new AtomicInteger();

        SessionCrawlListener(String sessionId, CrawlState state, Path root) {
            this.sessionId = sessionId;
            this.state = state;
            this.root = root;
        }

        @Override
        public void onFingerprint(BuildToolFingerprint fingerprint) {
            machine.recordFingerprint(sessionId, fingerprint);
        }

        @Override
        public void onPageVisited(String url, String localPath, int pagesVisited) {
            machine.pagesVisited(sessionId, pagesVisited);
        }

        @Override
        public void onAssetSettled(DiscoveredAsset asset) {
            if (asset.isDownloaded()) {
                machine.assetFound(sessionId, asset);
            }
            int every = Math.max(1, sessionProperties.getCheckpointEveryAssets());
            if (settled.incrementAndGet() % every == 0) {
                checkpoint(sessionId, root, state);
            }
        }

        @Override
        public void onProgress(int settledAssets, int discoveredAssets) {
            machine.updateProgress(sessionId, SessionStateMachine.crawlProgress(settledAssets, discoveredAssets),
                    discoveredAssets);
        }
    }
}
