package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One resource referenced by a crawled page. Identity is the canonical source URL, unique
 * within a session. Records are never removed: failed downloads keep their reason.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveredAsset {

    private String url;
    private AssetType type;
    private String subtype;
    private String contentType;
    private long size;
    private Instant discoveredAt;
    private volatile DownloadStatus status = DownloadStatus.PENDING;
    private volatile String failureReason;
    private volatile String localPath;
    // page that first referenced this asset
    private String referrer;
    private List<String> frameworkHints = new ArrayList<>();
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public DiscoveredAsset() {
    }

    public DiscoveredAsset(String url, AssetType type, String referrer) {
        this.url = url;
        this.type = type;
        this.referrer = referrer;
        this.discoveredAt = Instant.now();
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public AssetType getType() { return type; }
    public void setType(AssetType type) { this.type = type; }
    public String getSubtype() { return subtype; }
    public void setSubtype(String subtype) { this.subtype = subtype; }
    public String getContentType() { return contentType; }
    public void setContentType(String contentType) { this.contentType = contentType; }
    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }
    public Instant getDiscoveredAt() { return discoveredAt; }
    public void setDiscoveredAt(Instant discoveredAt) { this.discoveredAt = discoveredAt; }
    public DownloadStatus getStatus() { return status; }
    public void setStatus(DownloadStatus status) { this.status = status; }
    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }
    public String getLocalPath() { return localPath; }
    public void setLocalPath(String localPath) { this.localPath = localPath; }
    public String getReferrer() { return referrer; }
    public void setReferrer(String referrer) { this.referrer = referrer; }
    public List<String> getFrameworkHints() { return frameworkHints; }
    public void setFrameworkHints(List<String> frameworkHints) {
        this.frameworkHints = frameworkHints == null ? new ArrayList<String>() : frameworkHints;
    }
    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<String, Object>() : metadata;
    }

    public boolean isDownloaded() {
        return status == DownloadStatus.DOWNLOADED;
    }

    public void applyClassification(AssetClassification classification) {
        this.type = classification.getType();
        this.subtype = classification.getSubtype();
    }

    /**
     * Settles a pending download. Returns false when the asset already left PENDING, for
     * example because a stop marked it abandoned first.
     */
    public synchronized boolean markDownloaded(String localPath, String contentType, long size) {
        if (status != DownloadStatus.PENDING) return false;
        this.localPath = localPath;
        this.contentType = contentType;
        this.size = size;
        this.failureReason = null;
        this.status = DownloadStatus.DOWNLOADED;
        return true;
    }

    public synchronized boolean markFailed(String reason) {
        if (status != DownloadStatus.PENDING) return false;
        this.failureReason = reason;
        this.status = DownloadStatus.FAILED;
        return true;
    }

    public synchronized boolean markAbandoned(String reason) {
        if (status != DownloadStatus.PENDING) return false;
        this.failureReason = reason;
        this.status = DownloadStatus.ABANDONED;
        return true;
    }

    // ABANDONED back to PENDING so a resumed crawl downloads it again
    public synchronized boolean requeue() {
        if (status != DownloadStatus.ABANDONED) return false;
        this.failureReason = null;
        this.status = DownloadStatus.PENDING;
        return true;
    }

    public String fileName() {
        if (url == null) return "unknown";
        String path = url;
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        return name.isEmpty() ? "unknown" : name;
    }
}
