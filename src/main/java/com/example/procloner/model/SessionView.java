package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Read-only projection of a session for the REST surface.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionView {

    private String sessionId;
    private String url;
    private String status;
    private int progress;
    private int assets;
    private int pagesVisited;
    private Instant startTime;
    private Instant completedAt;
    private Instant interruptedAt;
    private String duration;
    private String error;
    private boolean canRecover;
    private String buildTool;
    private Double buildToolConfidence;

    public static SessionView of(CloneSession s, boolean canRecover) {
        SessionView v = new SessionView();
        v.sessionId = s.getId();
        v.url = s.getUrl();
        v.status = s.getStatus().value();
        v.progress = s.getProgress();
        v.assets = s.getAssetCount();
        v.pagesVisited = s.getPagesVisited();
        v.startTime = s.getStartTime();
        v.completedAt = s.getCompletedAt();
        v.interruptedAt = s.getInterruptedAt();
        v.duration = s.getDuration();
        v.error = s.getError();
        v.canRecover = canRecover;
        if (s.getFingerprint() != null) {
            v.buildTool = s.getFingerprint().getTool().value();
            v.buildToolConfidence = s.getFingerprint().getConfidence();
        }
        return v;
    }

    public String getSessionId() { return sessionId; }
    public String getUrl() { return url; }
    public String getStatus() { return status; }
    public int getProgress() { return progress; }
    public int getAssets() { return assets; }
    public int getPagesVisited() { return pagesVisited; }
    public Instant getStartTime() { return startTime; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getInterruptedAt() { return interruptedAt; }
    public String getDuration() { return duration; }
    public String getError() { return error; }
    public boolean isCanRecover() { return canRecover; }
    public String getBuildTool() { return buildTool; }
    public Double getBuildToolConfidence() { return buildToolConfidence; }
}
