package com.example.procloner.service;

import com.example.procloner.config.CrawlProperties;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CrawlState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Owns the worker pool shared by every session and creates one {@link CrawlExecution} per
 * session run. Each execution caps its own in-flight work at the configured download
 * concurrency, so sessions share threads but never queues.
 */
@Service
public class CrawlEngine {

    private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

    private final ResourceFetcher fetcher;
    private final AssetClassifier classifier;
    private final BuildToolDetector detector;
    private final PageAnalyzer analyzer;
    private final ReferenceExtractor references;
    private final CrawlProperties properties;
    private ExecutorService workers;

    public CrawlEngine(ResourceFetcher fetcher,
                       AssetClassifier classifier,
                       BuildToolDetector detector,
                       PageAnalyzer analyzer,
                       ReferenceExtractor references,
                       CrawlProperties properties) {
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.detector = detector;
        this.analyzer = analyzer;
        this.references = references;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        int threads = Math.max(2, properties.getWorkerPoolSize());
        this.workers = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<Runnable>(threads * 8),
                new ThreadFactory() {
                    private final ThreadFactory df = Executors.defaultThreadFactory();
                    public Thread newThread(Runnable r) {
                        Thread t = df.newThread(r);
                        t.setName("crawl-worker-" + t.getId());
                        t.setDaemon(true);
                        return t;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy());
        log.info("[BFS] worker pool started with {} threads", threads);
    }

    @PreDestroy
    public void shutdown() {
        if (workers != null) workers.shutdownNow();
    }

    public CrawlExecution newExecution(String sessionId,
                                       CrawlState state,
                                       Path outputRoot,
                                       CloneOptions options,
                                       Instant deadline,
                                       CrawlListener listener) {
        return new CrawlExecution(sessionId, state, outputRoot, options, deadline,
                listener == null ? CrawlListener.NONE : listener,
                fetcher, classifier, detector, analyzer, references, properties, workers);
    }
}
