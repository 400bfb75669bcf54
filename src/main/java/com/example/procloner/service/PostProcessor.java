package com.example.procloner.service;

import com.example.procloner.model.AssetType;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CrawlState;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.DownloadStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntConsumer;

/**
 * The processing phase: points saved pages and stylesheets at local copies, optionally
 * optimises images, and writes the manifest, build-tool info and service worker.
 * <p>
 * Progress is reported between {@link SessionStateMachine#CRAWL_PHASE_WEIGHT} and 99; the
 * state machine raises it to 100 on completion. The session deadline is checked between steps
 * and before each image.
 */
@Component
public class PostProcessor {

    private static final Logger log = LoggerFactory.getLogger(PostProcessor.class);

    static final String MANIFEST_FILE = "asset-manifest.json";
    static final String BUILD_TOOL_FILE = "build-tool-info.json";
    static final String SERVICE_WORKER_FILE = "sw.js";

    private final ReferenceRewriter rewriter;
    private final ImageOptimizer imageOptimizer;
    private final ObjectMapper objectMapper;

    public PostProcessor(ReferenceRewriter rewriter, ImageOptimizer imageOptimizer, ObjectMapper objectMapper) {
        this.rewriter = rewriter;
        this.imageOptimizer = imageOptimizer;
        this.objectMapper = objectMapper;
    }

    /**
     * @param deadline when the session times out, or {@code null} for no limit
     * @param progress receives the overall percentage as steps finish
     * @throws SessionTimeoutException when the deadline passes before processing is done
     * @throws IOException             when a manifest file cannot be written
     */
    public void process(String sessionId, String sourceUrl, CrawlState state, CloneOptions options,
                        Path outputRoot, Instant deadline, IntConsumer progress) throws IOException {
        checkDeadline(sessionId, deadline, "rewriting");
        Map<String, String> localByUrl = localCopies(state);
        int base = SessionStateMachine.CRAWL_PHASE_WEIGHT;

        int pageRefs = 0;
        for (Map.Entry<String, String> page : state.getPages().entrySet()) {
            try {
                pageRefs += rewriter.rewritePage(outputRoot, page.getKey(), page.getValue(), localByUrl);
            } catch (IOException e) {
                log.warn("[POST] session={} could not rewrite page {}: {}", sessionId, page.getValue(), e.getMessage());
            }
        }
        int cssRewritten = 0;
        for (DiscoveredAsset asset : state.assetsInDiscoveryOrder()) {
            if (asset.isDownloaded() && asset.getType() == AssetType.STYLESHEET) {
                try {
                    if (rewriter.rewriteStylesheet(outputRoot, asset.getUrl(), asset.getLocalPath(), localByUrl)) {
                        cssRewritten++;
                    }
                } catch (IOException e) {
                    log.warn("[POST] session={} could not rewrite stylesheet {}: {}", sessionId,
                            asset.getLocalPath(), e.getMessage());
                }
            }
        }
        log.info("[POST] session={} rewrote {} page references, {} stylesheets", sessionId, pageRefs, cssRewritten);
        progress.accept(base + 3);

        if (options.isOptimizeImages()) {
            BuildToolFingerprint fp = state.getFingerprint();
            PathMapper mapper = new PathMapper(fp == null ? null : fp.getTool(), state.pathTable());
            int optimized = 0;
            for (DiscoveredAsset asset : state.assetsInDiscoveryOrder()) {
                checkDeadline(sessionId, deadline, "image optimisation");
                try {
                    if (imageOptimizer.optimize(outputRoot, asset, mapper) != null) optimized++;
                } catch (IOException e) {
                    log.debug("[POST] session={} image {} skipped: {}", sessionId, asset.getLocalPath(), e.getMessage());
                }
            }
            log.info("[POST] session={} optimized {} images", sessionId, optimized);
        }
        progress.accept(base + 6);

        checkDeadline(sessionId, deadline, "manifest");
        writeJson(outputRoot.resolve(MANIFEST_FILE), manifest(sessionId, sourceUrl, state));
        writeJson(outputRoot.resolve(BUILD_TOOL_FILE), buildToolInfo(state));
        progress.accept(base + 8);

        if (options.isGenerateServiceWorker()) {
            Files.write(outputRoot.resolve(SERVICE_WORKER_FILE),
                    serviceWorker(sessionId, state).getBytes(StandardCharsets.UTF_8));
            log.info("[POST] session={} wrote {}", sessionId, SERVICE_WORKER_FILE);
        }
        progress.accept(base + 9);
    }

    private static void checkDeadline(String sessionId, Instant deadline, String step) throws SessionTimeoutException {
        if (deadline != null && Instant.now().isAfter(deadline)) {
            log.warn("[POST] session={} deadline passed before {}", sessionId, step);
            throw new SessionTimeoutException("Session deadline passed before " + step);
        }
    }

    static Map<String, String> localCopies(CrawlState state) {
        Map<String, String> local = new LinkedHashMap<>(state.getPages());
        for (DiscoveredAsset asset : state.getAssets().values()) {
            if (asset.isDownloaded()) local.put(asset.getUrl(), asset.getLocalPath());
        }
        return local;
    }

    Map<String, Object> manifest(String sessionId, String sourceUrl, CrawlState state) {
        List<DiscoveredAsset> assets = state.assetsInDiscoveryOrder();
        Map<String, Integer> byType = new TreeMap<>();
        for (DiscoveredAsset a : assets) {
            if (!a.isDownloaded()) continue;
            String key = a.getType().value();
            Integer n = byType.get(key);
            byType.put(key, n == null ? 1 : n + 1);
        }
        Map<String, Object> totals = new LinkedHashMap<>();
        totals.put("assets", assets.size());
        totals.put("downloaded", state.countAssets(DownloadStatus.DOWNLOADED));
        totals.put("failed", state.countAssets(DownloadStatus.FAILED));
        totals.put("pages", state.getPages().size());

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sessionId", sessionId);
        m.put("sourceUrl", sourceUrl);
        m.put("generatedAt", Instant.now().toString());
        BuildToolFingerprint fp = state.getFingerprint();
        m.put("buildTool", fp == null ? BuildToolFingerprint.unknown().getTool().value() : fp.getTool().value());
        m.put("totals", totals);
        m.put("byType", byType);
        m.put("pages", state.getPages());
        m.put("assets", assets);
        return m;
    }

    private static Map<String, Object> buildToolInfo(CrawlState state) {
        BuildToolFingerprint fp = state.getFingerprint() == null ? BuildToolFingerprint.unknown() : state.getFingerprint();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("tool", fp.getTool().value());
        info.put("confidence", fp.getConfidence());
        info.put("evidence", fp.getSignals());
        if (state.getSignals() != null) info.put("signals", state.getSignals());
        return info;
    }

    static String serviceWorker(String sessionId, CrawlState state) {
        List<String> urls = new ArrayList<>();
        urls.add("/");
        for (DiscoveredAsset asset : state.assetsInDiscoveryOrder()) {
            if (asset.isDownloaded()) urls.add("/" + asset.getLocalPath());
        }
        StringBuilder list = new StringBuilder();
        for (String u : urls) {
            if (list.length() > 0) list.append(",\n");
            list.append("  '").append(u.replace("\\", "\\\\").replace("'", "\\'")).append('\'');
        }
        String cacheName = "procloner-" + sessionId.substring(0, Math.min(8, sessionId.length()));
        return "const CACHE_NAME = '" + cacheName + "';\n"
                + "const urlsToCache = [\n" + list + "\n];\n\n"
                + "self.addEventListener('install', event => {\n"
                + "  event.waitUntil(caches.open(CACHE_NAME).then(cache => cache.addAll(urlsToCache)));\n"
                + "});\n\n"
                + "self.addEventListener('activate', event => {\n"
                + "  event.waitUntil(caches.keys().then(names => Promise.all(\n"
                + "    names.filter(name => name !== CACHE_NAME).map(name => caches.delete(name)))));\n"
                + "});\n\n"
                + "self.addEventListener('fetch', event => {\n"
                + "  event.respondWith(caches.match(event.request).then(hit => hit || fetch(event.request)));\n"
                + "});\n";
    }

    private void writeJson(Path file, Object value) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
    }
}
