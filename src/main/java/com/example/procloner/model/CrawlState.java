package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything a crawl has learned about one session: page frontier, asset ledger, the
 * URL to local path table and the frozen build-tool fingerprint. Serialized as the
 * {@code session-state.json} checkpoint so an interrupted session can pick up where it stopped.
 * <p>
 * The path table is guarded by its own monitor; callers that mutate it must hold it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlState {

    private String rootUrl;
    private int depth;
    private final Map<String, DiscoveredAsset> assets = new ConcurrentHashMap<>();
    private final Map<String, String> pathTable = new LinkedHashMap<>();
    // fetched pages and the local file each was saved to
    private final Map<String, String> pages = new ConcurrentHashMap<>();
    // queued but not yet fetched, with their level
    private final Map<String, Integer> pendingPages = new ConcurrentHashMap<>();
    private final Set<String> visitedPages = ConcurrentHashMap.newKeySet();
    // linked beyond the depth limit, recorded only
    private final Set<String> deferredPages = ConcurrentHashMap.newKeySet();
    private volatile BuildToolFingerprint fingerprint;
    private volatile BuildToolSignals signals;
    private final AtomicInteger pagesVisited = new AtomicInteger();

    public CrawlState() {
    }

    public CrawlState(String rootUrl, int depth) {
        this.rootUrl = rootUrl;
        this.depth = depth;
    }

    public String getRootUrl() { return rootUrl; }
    public void setRootUrl(String rootUrl) { this.rootUrl = rootUrl; }
    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public Map<String, DiscoveredAsset> getAssets() { return assets; }
    public void setAssets(Map<String, DiscoveredAsset> assets) {
        this.assets.clear();
        if (assets != null) this.assets.putAll(assets);
    }

    @JsonIgnore
    public Map<String, String> pathTable() { return pathTable; }

    public Map<String, String> getPathTable() {
        synchronized (pathTable) {
            return new LinkedHashMap<>(pathTable);
        }
    }

    public void setPathTable(Map<String, String> table) {
        synchronized (pathTable) {
            pathTable.clear();
            if (table != null) pathTable.putAll(table);
        }
    }

    public Map<String, String> getPages() { return pages; }
    public void setPages(Map<String, String> pages) {
        this.pages.clear();
        if (pages != null) this.pages.putAll(pages);
    }

    public Map<String, Integer> getPendingPages() { return pendingPages; }
    public void setPendingPages(Map<String, Integer> pendingPages) {
        this.pendingPages.clear();
        if (pendingPages != null) this.pendingPages.putAll(pendingPages);
    }

    public Set<String> getVisitedPages() { return visitedPages; }
    public void setVisitedPages(Set<String> visitedPages) {
        this.visitedPages.clear();
        if (visitedPages != null) this.visitedPages.addAll(visitedPages);
    }

    public Set<String> getDeferredPages() { return deferredPages; }
    public void setDeferredPages(Set<String> deferredPages) {
        this.deferredPages.clear();
        if (deferredPages != null) this.deferredPages.addAll(deferredPages);
    }

    public BuildToolFingerprint getFingerprint() { return fingerprint; }
    public void setFingerprint(BuildToolFingerprint fingerprint) { this.fingerprint = fingerprint; }
    public BuildToolSignals getSignals() { return signals; }
    public void setSignals(BuildToolSignals signals) { this.signals = signals; }

    public int getPagesVisited() { return pagesVisited.get(); }
    public void setPagesVisited(int value) { pagesVisited.set(value); }

    public int incrementPagesVisited() {
        return pagesVisited.incrementAndGet();
    }

    /**
     * Freezes the fingerprint once. Later calls keep the first value and return it.
     */
    public synchronized BuildToolFingerprint freezeFingerprint(BuildToolFingerprint detected, BuildToolSignals evidence) {
        if (fingerprint == null) {
            fingerprint = detected == null ? BuildToolFingerprint.unknown() : detected;
            signals = evidence;
        }
        return fingerprint;
    }

    @JsonIgnore
    public boolean isFingerprintFrozen() {
        return fingerprint != null;
    }

    @JsonIgnore
    public List<DiscoveredAsset> assetsInDiscoveryOrder() {
        List<DiscoveredAsset> list = new ArrayList<>(assets.values());
        Collections.sort(list, new Comparator<DiscoveredAsset>() {
            public int compare(DiscoveredAsset a, DiscoveredAsset b) {
                if (a.getDiscoveredAt() == null || b.getDiscoveredAt() == null) {
                    return a.getUrl().compareTo(b.getUrl());
                }
                int c = a.getDiscoveredAt().compareTo(b.getDiscoveredAt());
                return c != 0 ? c : a.getUrl().compareTo(b.getUrl());
            }
        });
        return list;
    }

    public int countAssets(DownloadStatus status) {
        int n = 0;
        for (DiscoveredAsset a : assets.values()) {
            if (a.getStatus() == status) n++;
        }
        return n;
    }

    // downloaded + failed, the numerator of crawl progress
    public int settledAssetCount() {
        return countAssets(DownloadStatus.DOWNLOADED) + countAssets(DownloadStatus.FAILED);
    }

    @JsonIgnore
    public boolean hasPartialResults() {
        return !pages.isEmpty() || !assets.isEmpty() || !pendingPages.isEmpty();
    }
}
