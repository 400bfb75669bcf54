package com.example.procloner.model;

import javax.persistence.*;
import java.time.Instant;

/**
 * Persisted snapshot of a session, enough to offer recovery after a restart.
 */
@Entity
@Table(name = "clone_session")
public class CloneSessionEntity {
    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(name = "status", length = 20, nullable = false)
    private String status;

    @Column(name = "source_url", length = 2000, nullable = false)
    private String sourceUrl;

    @Column(name = "options_json", columnDefinition = "TEXT")
    private String optionsJson;

    @Column(name = "progress")
    private Integer progress;

    @Column(name = "asset_count")
    private Integer assetCount;

    @Column(name = "pages_visited")
    private Integer pagesVisited;

    @Column(name = "output_dir", length = 1024)
    private String outputDir;

    @Column(name = "build_tool", length = 40)
    private String buildTool;

    @Column(name = "build_tool_confidence")
    private Double buildToolConfidence;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "interrupted_at")
    private Instant interruptedAt;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getSourceUrl() { return sourceUrl; }
    public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }
    public String getOptionsJson() { return optionsJson; }
    public void setOptionsJson(String optionsJson) { this.optionsJson = optionsJson; }
    public Integer getProgress() { return progress; }
    public void setProgress(Integer progress) { this.progress = progress; }
    public Integer getAssetCount() { return assetCount; }
    public void setAssetCount(Integer assetCount) { this.assetCount = assetCount; }
    public Integer getPagesVisited() { return pagesVisited; }
    public void setPagesVisited(Integer pagesVisited) { this.pagesVisited = pagesVisited; }
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    public String getBuildTool() { return buildTool; }
    public void setBuildTool(String buildTool) { this.buildTool = buildTool; }
    public Double getBuildToolConfidence() { return buildToolConfidence; }
    public void setBuildToolConfidence(Double buildToolConfidence) { this.buildToolConfidence = buildToolConfidence; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Instant getInterruptedAt() { return interruptedAt; }
    public void setInterruptedAt(Instant interruptedAt) { this.interruptedAt = interruptedAt; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public String getResultJson() { return resultJson; }
    public void setResultJson(String resultJson) { this.resultJson = resultJson; }
}
