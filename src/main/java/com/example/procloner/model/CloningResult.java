package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Terminal outcome handed to packaging collaborators.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CloningResult {

    private String sessionId;
    private boolean success;
    private int assetsFound;
    private int assetsDownloaded;
    private int assetsFailed;
    private int pagesVisited;
    private String error;
    private String outputDirectory;
    private Set<ExportFormat> exportFormat = new LinkedHashSet<>();

    public CloningResult() {
    }

    public CloningResult(String sessionId) {
        this.sessionId = sessionId;
    }

    public static CloningResult failure(String sessionId, String error) {
        CloningResult r = new CloningResult(sessionId);
        r.setSuccess(false);
        r.setError(error);
        return r;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }
    public int getAssetsFound() { return assetsFound; }
    public void setAssetsFound(int assetsFound) { this.assetsFound = assetsFound; }
    public int getAssetsDownloaded() { return assetsDownloaded; }
    public void setAssetsDownloaded(int assetsDownloaded) { this.assetsDownloaded = assetsDownloaded; }
    public int getAssetsFailed() { return assetsFailed; }
    public void setAssetsFailed(int assetsFailed) { this.assetsFailed = assetsFailed; }
    public int getPagesVisited() { return pagesVisited; }
    public void setPagesVisited(int pagesVisited) { this.pagesVisited = pagesVisited; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error; }
    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public Set<ExportFormat> getExportFormat() {
        return Collections.unmodifiableSet(exportFormat);
    }

    public void setExportFormat(Set<ExportFormat> exportFormat) {
        this.exportFormat = exportFormat == null ? new LinkedHashSet<ExportFormat>() : new LinkedHashSet<>(exportFormat);
    }
}
