package com.example.procloner.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One cloning job. Fields are written only by the session state machine while it holds the
 * session's lock; readers see them through volatile reads.
 */
public class CloneSession {

    private final String id;
    private final String url;
    private final CloneOptions options;
    private volatile SessionStatus status;
    private volatile int progress;
    private volatile int assetCount;
    private volatile int pagesVisited;
    private volatile Instant startTime;
    private volatile Instant completedAt;
    private volatile Instant interruptedAt;
    // start of the current execution, the timeout is measured from here
    private volatile Instant executionStartedAt;
    private volatile String error;
    private volatile String outputDir;
    private volatile BuildToolFingerprint fingerprint;
    private volatile CloningResult result;
    private volatile CrawlState crawlState;

    public CloneSession(String url, CloneOptions options) {
        this(UUID.randomUUID().toString(), url, options);
    }

    public CloneSession(String id, String url, CloneOptions options) {
        this.id = id;
        this.url = url;
        this.options = options == null ? new CloneOptions() : options;
        this.status = SessionStatus.STARTING;
        this.startTime = Instant.now();
    }

    public String getId() { return id; }
    public String getUrl() { return url; }
    public CloneOptions getOptions() { return options; }
    public SessionStatus getStatus() { return status; }
    public void setStatus(SessionStatus status) { this.status = status; }
    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }
    public int getAssetCount() { return assetCount; }
    public void setAssetCount(int assetCount) { this.assetCount = assetCount; }
    public int getPagesVisited() { return pagesVisited; }
    public void setPagesVisited(int pagesVisited) { this.pagesVisited = pagesVisited; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Instant getInterruptedAt() { return interruptedAt; }
    public void setInterruptedAt(Instant interruptedAt) { this.interruptedAt = interruptedAt; }
    public Instant getExecutionStartedAt() { return executionStartedAt; }
    public void setExecutionStartedAt(Instant executionStartedAt) { this.executionStartedAt = executionStartedAt; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    public BuildToolFingerprint getFingerprint() { return fingerprint; }
    public void setFingerprint(BuildToolFingerprint fingerprint) { this.fingerprint = fingerprint; }
    public CloningResult getResult() { return result; }
    public void setResult(CloningResult result) { this.result = result; }
    public CrawlState getCrawlState() { return crawlState; }
    public void setCrawlState(CrawlState crawlState) { this.crawlState = crawlState; }

    /**
     * When the session last stopped running: completion for terminal sessions, the interrupt
     * time for interrupted ones, {@code null} while active.
     */
    public Instant getEndedAt() {
        SessionStatus s = status;
        if (s.isTerminal()) return completedAt;
        if (s == SessionStatus.INTERRUPTED) return interruptedAt;
        return null;
    }

    public boolean isRetentionExpired(Duration retention, Instant now) {
        Instant ended = getEndedAt();
        return ended != null && ended.plus(retention).isBefore(now);
    }

    public String getDuration() {
        Instant end = completedAt != null ? completedAt : Instant.now();
        Instant start = startTime != null ? startTime : end;
        Duration d = Duration.between(start, end);
        long s = d.getSeconds();
        long m = s / 60; s = s % 60;
        return (m > 0 ? (m + "m ") : "") + s + "s";
    }
}
