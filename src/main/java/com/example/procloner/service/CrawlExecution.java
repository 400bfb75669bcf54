package com.example.procloner.service;

import com.example.procloner.config.CrawlProperties;
import com.example.procloner.model.AssetClassification;
import com.example.procloner.model.AssetType;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.CrawlState;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.DownloadStatus;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One run of the crawl loop for one session.
 * <p>
 * The root page is fetched on the calling thread so its signals can freeze the build-tool
 * fingerprint before any asset is mapped. After that a single driver loop hands page and
 * asset work to the shared pool, never holding more than the download-concurrency cap in
 * flight. The run ends when the queue is empty and nothing is in flight, or when a stop is
 * requested or the deadline passes.
 */
public class CrawlExecution {

    private static final Logger log = LoggerFactory.getLogger(CrawlExecution.class);

    private static final long POLL_MS = 100L;
    private static final long STOP_GRACE_MS = 5000L;

    public enum StopReason { NONE, CANCELLED, PAUSED, TIMED_OUT }

    private final String sessionId;
    private final CrawlState state;
    private final Path outputRoot;
    private final CloneOptions options;
    private final Instant deadline;
    private final CrawlListener listener;
    private final ResourceFetcher fetcher;
    private final AssetClassifier classifier;
    private final BuildToolDetector detector;
    private final PageAnalyzer analyzer;
    private final ReferenceExtractor references;
    private final CrawlProperties properties;
    private final ExecutorService workers;

    private final LinkedBlockingDeque<WorkItem> queue = new LinkedBlockingDeque<>();
    private final Map<WorkItem, Future<?>> running = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Semaphore permits;
    private final Set<String> pageHosts = ConcurrentHashMap.newKeySet();
    private volatile StopReason stopReason = StopReason.NONE;
    private volatile PathMapper mapper;

    CrawlExecution(String sessionId,
                   CrawlState state,
                   Path outputRoot,
                   CloneOptions options,
                   Instant deadline,
                   CrawlListener listener,
                   ResourceFetcher fetcher,
                   AssetClassifier classifier,
                   BuildToolDetector detector,
                   PageAnalyzer analyzer,
                   ReferenceExtractor references,
                   CrawlProperties properties,
                   ExecutorService workers) {
        this.sessionId = sessionId;
        this.state = state;
        this.outputRoot = outputRoot;
        this.options = options;
        this.deadline = deadline;
        this.listener = listener;
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.detector = detector;
        this.analyzer = analyzer;
        this.references = references;
        this.properties = properties;
        this.workers = workers;
        this.permits = new Semaphore(Math.max(1, properties.getDownloadConcurrency()));
    }

    /**
     * Crawls until the work drains or the run is stopped.
     *
     * @throws PageFetchException when the root page cannot be fetched
     * @throws IOException        when the output root cannot be created
     */
    public CloningResult run() throws IOException {
        Files.createDirectories(outputRoot);
        String rootHost = host(state.getRootUrl());
        if (rootHost != null) pageHosts.add(rootHost);

        if (!state.isFingerprintFrozen()) {
            log.info("[BFS][START] session={} root={} depth={}", sessionId, state.getRootUrl(), state.getDepth());
            state.getVisitedPages().add(state.getRootUrl());
            state.getPendingPages().put(state.getRootUrl(), 1);
            crawlPage(state.getRootUrl(), 1, true);
            if (deadlinePassed()) stop(StopReason.TIMED_OUT);
        } else {
            log.info("[BFS][RESUME] session={} pendingPages={} assets={}", sessionId,
                    state.getPendingPages().size(), state.getAssets().size());
            ensureMapper();
            requeuePending();
        }

        drain();

        CloningResult result = new CloningResult(sessionId);
        result.setAssetsFound(state.getAssets().size());
        result.setAssetsDownloaded(state.countAssets(DownloadStatus.DOWNLOADED));
        result.setAssetsFailed(state.countAssets(DownloadStatus.FAILED));
        result.setPagesVisited(state.getPagesVisited());
        result.setOutputDirectory(outputRoot.toAbsolutePath().toString());
        result.setExportFormat(options.getExportFormat());
        result.setSuccess(stopReason == StopReason.NONE);
        if (stopReason != StopReason.NONE) {
            result.setError("Crawl stopped: " + stopReason.name().toLowerCase(Locale.ROOT));
        }
        log.info("[BFS][END] session={} pages={} assets={} downloaded={} failed={} stop={}", sessionId,
                result.getPagesVisited(), result.getAssetsFound(), result.getAssetsDownloaded(),
                result.getAssetsFailed(), stopReason);
        return result;
    }

    /**
     * Asks the run to stop. The first reason wins; new work is no longer dispatched and
     * downloads still in flight are marked abandoned.
     */
    public void stop(StopReason reason) {
        synchronized (this) {
            if (stopReason != StopReason.NONE || reason == StopReason.NONE) return;
            stopReason = reason;
        }
        log.info("[BFS][STOP] session={} reason={}", sessionId, reason);
    }

    public StopReason getStopReason() {
        return stopReason;
    }

    public boolean isStopped() {
        return stopReason != StopReason.NONE;
    }

    public CrawlState getState() {
        return state;
    }

    public Instant getDeadline() {
        return deadline;
    }

    private boolean deadlinePassed() {
        return deadline != null && Instant.now().isAfter(deadline);
    }

    private void drain() {
        try {
            while (true) {
                if (isStopped()) break;
                if (deadlinePassed()) {
                    stop(StopReason.TIMED_OUT);
                    break;
                }
                final WorkItem item = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (item == null) {
                    if (inFlight.get() == 0 && queue.isEmpty()) break;
                    continue;
                }
                if (!permits.tryAcquire(POLL_MS, TimeUnit.MILLISECONDS)) {
                    queue.addFirst(item);
                    continue;
                }
                inFlight.incrementAndGet();
                try {
                    // registered before the task can run so its finally block finds the entry
                    running.put(item, new CompletableFuture<Void>());
                    Future<?> f = workers.submit(new Runnable() {
                        public void run() {
                            try {
                                process(item);
                            } finally {
                                running.remove(item);
                                inFlight.decrementAndGet();
                                permits.release();
                            }
                        }
                    });
                    running.replace(item, f);
                } catch (RejectedExecutionException ex) {
                    running.remove(item);
                    inFlight.decrementAndGet();
                    permits.release();
                    queue.addFirst(item);
                    Thread.sleep(POLL_MS);
                }
            }
        } catch (InterruptedException e) {
            stop(StopReason.PAUSED);
            Thread.currentThread().interrupt();
        }
        if (isStopped()) {
            abandonInFlight();
        }
    }

    private void abandonInFlight() {
        String reason = "Abandoned: session " + stopReason.name().toLowerCase(Locale.ROOT);
        for (Map.Entry<WorkItem, Future<?>> e : running.entrySet()) {
            WorkItem item = e.getKey();
            if (item.asset != null) {
                item.asset.markAbandoned(reason);
            }
            e.getValue().cancel(true);
        }
        long waitUntil = System.currentTimeMillis() + STOP_GRACE_MS;
        while (inFlight.get() > 0 && System.currentTimeMillis() < waitUntil) {
            try {
                Thread.sleep(20L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (inFlight.get() > 0) {
            log.warn("[BFS][STOP] session={} {} workers still running after grace period", sessionId, inFlight.get());
        }
    }

    private void process(WorkItem item) {
        if (item.asset != null) {
            downloadAsset(item.asset);
        } else {
            try {
                crawlPage(item.pageUrl, item.level, false);
            } catch (IOException | RuntimeException e) {
                state.getPendingPages().remove(item.pageUrl);
                log.warn("[BFS][PAGE-FAIL] session={} {} -> {}", sessionId, item.pageUrl, describe(e));
            }
        }
    }

    private void requeuePending() {
        for (Map.Entry<String, Integer> page : state.getPendingPages().entrySet()) {
            queue.add(WorkItem.page(page.getKey(), page.getValue()));
        }
        for (DiscoveredAsset asset : state.assetsInDiscoveryOrder()) {
            asset.requeue();
            if (asset.getStatus() == DownloadStatus.PENDING) {
                queue.add(WorkItem.asset(asset));
            }
        }
    }

    void crawlPage(String url, int level, boolean root) throws IOException {
        if (isStopped()) return;
        FetchedResource res;
        try {
            res = fetcher.fetch(url, root ? null : state.getRootUrl());
        } catch (IOException e) {
            if (root) {
                throw new PageFetchException(url, "Root page unreachable: " + e.getMessage(), e);
            }
            state.getPendingPages().remove(url);
            throw e;
        }
        if (!res.isSuccess()) {
            if (root) {
                throw new PageFetchException(url, "Root page returned HTTP " + res.getStatusCode());
            }
            log.info("[BFS][SKIP-{}] session={} {}", res.getStatusCode(), sessionId, url);
            state.getPendingPages().remove(url);
            return;
        }
        if (!looksLikeHtml(res)) {
            if (root) {
                throw new PageFetchException(url, "Root page is not HTML: " + res.getContentType());
            }
            state.getPendingPages().remove(url);
            registerAsset(url, state.getRootUrl());
            return;
        }
        if (isStopped()) return;

        Document doc = Jsoup.parse(new ByteArrayInputStream(res.getBody()), null, res.getUrl());
        PageAnalyzer.PageScan scan = analyzer.scan(doc);
        if (root) {
            String finalHost = host(res.getUrl());
            if (finalHost != null) pageHosts.add(finalHost);
            BuildToolFingerprint detected = detector.analyze(scan.getSignals());
            BuildToolFingerprint frozen = state.freezeFingerprint(detected, scan.getSignals());
            log.info("[BFS][FINGERPRINT] session={} tool={} confidence={}", sessionId,
                    frozen.getTool().value(), frozen.getConfidence());
            listener.onFingerprint(frozen);
        }
        ensureMapper();

        String localPath = mapper.assignPage(url);
        Path target = outputRoot.resolve(localPath);
        Files.createDirectories(target.getParent());
        Files.write(target, res.getBody());
        state.getPages().put(url, localPath);
        state.getPendingPages().remove(url);
        int visited = state.incrementPagesVisited();
        log.info("[BFS][VISIT] session={} level={} -> {}", sessionId, level, url);
        listener.onPageVisited(url, localPath, visited);

        for (String link : scan.getLinks()) {
            enqueueLink(link, level);
        }
        for (String assetUrl : scan.getAssets()) {
            registerAsset(assetUrl, url);
        }
    }

    private void enqueueLink(String link, int level) {
        if (!isHttp(link) || !pageHosts.contains(host(link))) return;
        if (!isLikelyHtml(link)) {
            AssetType guess = classifier.classifyByUrl(link).getType();
            if (guess != AssetType.OTHER && guess != AssetType.HTML) {
                registerAsset(link, state.getRootUrl());
            }
            return;
        }
        if (state.getPages().containsKey(link)) return;
        if (level + 1 > state.getDepth()) {
            if (!state.getVisitedPages().contains(link) && state.getDeferredPages().add(link)) {
                log.debug("[BFS][DEFER] session={} beyond depth -> {}", sessionId, link);
            }
            return;
        }
        if (state.getVisitedPages().add(link)) {
            state.getPendingPages().put(link, level + 1);
            queue.add(WorkItem.page(link, level + 1));
            log.debug("[BFS][ENQUEUE] session={} level={} -> {}", sessionId, level + 1, link);
        }
    }

    /**
     * Records an asset the first time it is referenced and queues its download. Assets that
     * cannot be fetched under the crawl policy are recorded as failed right away.
     */
    void registerAsset(String url, String referrer) {
        if (url == null || state.getAssets().containsKey(url) || state.getPages().containsKey(url)) return;
        AssetClassification guess = classifier.classifyByUrl(url);
        // unknown extensions are fetched and checked again once the content type is known
        if (guess.getType() != AssetType.OTHER && !options.includes(guess.getType())) return;

        DiscoveredAsset asset = new DiscoveredAsset(url, guess.getType(), referrer);
        asset.setSubtype(guess.getSubtype());
        if (state.getAssets().putIfAbsent(url, asset) != null) return;
        listener.onAssetDiscovered(asset);

        if (!isHttp(url)) {
            settle(asset, "Disallowed scheme: " + scheme(url));
            return;
        }
        if (!hostAllowed(url)) {
            settle(asset, "Cross-origin host not allowed: " + host(url));
            return;
        }
        queue.add(WorkItem.asset(asset));
        listener.onProgress(state.settledAssetCount(), state.getAssets().size());
    }

    void downloadAsset(DiscoveredAsset asset) {
        if (isStopped()) {
            asset.markAbandoned("Abandoned: session " + stopReason.name().toLowerCase(Locale.ROOT));
            return;
        }
        String url = asset.getUrl();
        try {
            FetchedResource res = fetcher.fetch(url, asset.getReferrer());
            if (isStopped()) {
                asset.markAbandoned("Abandoned: session " + stopReason.name().toLowerCase(Locale.ROOT));
                return;
            }
            if (!res.isSuccess()) {
                throw new AssetDownloadException("HTTP " + res.getStatusCode());
            }
            AssetClassification c = classifier.classify(url, res.getContentType(),
                    res.sample(properties.getSampleBytes()));
            asset.applyClassification(c);
            if (!options.includes(c.getType())) {
                settle(asset, "Asset type " + c.getType().value() + " not requested");
                return;
            }
            String localPath = mapper.assign(url, c.getType(), res.getContentType());
            Path target = outputRoot.resolve(localPath);
            Files.createDirectories(target.getParent());
            Files.write(target, res.getBody());
            if (!asset.markDownloaded(localPath, res.getContentType(), res.getBody().length)) {
                log.debug("[ASSET][LATE] session={} {} finished after it was settled as {}", sessionId, url,
                        asset.getStatus());
                return;
            }
            log.debug("[ASSET][OK] session={} {} -> {}", sessionId, url, localPath);

            if (c.getType() == AssetType.JAVASCRIPT) {
                String js = new String(res.getBody(), StandardCharsets.UTF_8);
                asset.setFrameworkHints(references.frameworkHints(js));
                for (String ref : references.scriptReferences(js, res.getUrl())) {
                    registerAsset(ref, url);
                }
            } else if (c.getType() == AssetType.STYLESHEET) {
                String css = new String(res.getBody(), StandardCharsets.UTF_8);
                for (String ref : references.cssReferences(css, res.getUrl())) {
                    registerAsset(ref, url);
                }
            }
            listener.onAssetSettled(asset);
        } catch (IOException | RuntimeException ex) {
            if (isStopped()) {
                asset.markAbandoned("Abandoned: session " + stopReason.name().toLowerCase(Locale.ROOT));
                return;
            }
            log.warn("[ASSET][FAIL] session={} {} -> {}", sessionId, url, describe(ex));
            if (asset.markFailed(describe(ex))) {
                listener.onAssetSettled(asset);
            }
        }
        listener.onProgress(state.settledAssetCount(), state.getAssets().size());
    }

    private static String describe(Exception ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private void settle(DiscoveredAsset asset, String reason) {
        if (!asset.markFailed(reason)) return;
        log.debug("[ASSET][SKIP] session={} {} -> {}", sessionId, asset.getUrl(), reason);
        listener.onAssetSettled(asset);
        listener.onProgress(state.settledAssetCount(), state.getAssets().size());
    }

    private void ensureMapper() {
        if (mapper == null) {
            synchronized (this) {
                if (mapper == null) {
                    BuildToolFingerprint fp = state.getFingerprint();
                    mapper = new PathMapper(fp == null ? null : fp.getTool(), state.pathTable());
                }
            }
        }
    }

    private boolean hostAllowed(String url) {
        String h = host(url);
        if (h == null) return false;
        if (pageHosts.contains(h)) return true;
        if (!properties.isCrossOriginAssets()) return false;
        List<String> allowed = properties.getAllowedAssetHosts();
        if (allowed == null || allowed.isEmpty()) return true;
        Set<String> lower = new HashSet<>();
        for (String a : allowed) lower.add(a.trim().toLowerCase(Locale.ROOT));
        return lower.contains(h);
    }

    private static boolean looksLikeHtml(FetchedResource res) {
        String ct = MediaTypes.baseType(res.getContentType());
        if (ct.isEmpty()) {
            String head = new String(res.sample(256), StandardCharsets.ISO_8859_1).trim().toLowerCase(Locale.ROOT);
            return head.startsWith("<!doctype html") || head.startsWith("<html");
        }
        return ct.contains("html");
    }

    // extension-based guess, pages are usually extension-less or .html
    static boolean isLikelyHtml(String url) {
        String ext = MediaTypes.extensionOf(url);
        if (ext.isEmpty()) return true;
        return ext.equals("html") || ext.equals("htm") || ext.equals("shtml") || ext.equals("xhtml")
                || ext.equals("php") || ext.equals("asp") || ext.equals("aspx") || ext.equals("jsp");
    }

    private static boolean isHttp(String url) {
        String s = scheme(url);
        return "http".equals(s) || "https".equals(s);
    }

    private static String scheme(String url) {
        try {
            String s = new URI(url).getScheme();
            return s == null ? "" : s.toLowerCase(Locale.ROOT);
        } catch (Exception e) {
            return "";
        }
    }

    private static String host(String url) {
        try {
            String h = new URI(url).getHost();
            return h == null ? null : h.toLowerCase(Locale.ROOT);
        } catch (Exception e) {
            return null;
        }
    }

    static final class WorkItem {
        final String pageUrl;
        final int level;
        final DiscoveredAsset asset;

        private WorkItem(String pageUrl, int level, DiscoveredAsset asset) {
            this.pageUrl = pageUrl;
            this.level = level;
            this.asset = asset;
        }

        static WorkItem page(String url, int level) {
            return new WorkItem(url, level, null);
        }

        static WorkItem asset(DiscoveredAsset asset) {
            return new WorkItem(null, 0, asset);
        }
    }
}
