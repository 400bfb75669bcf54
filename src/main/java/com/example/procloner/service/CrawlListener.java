package com.example.procloner.service;

import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.DiscoveredAsset;

/**
 * Callbacks from a running crawl. Invoked from worker threads, possibly concurrently.
 */
public interface CrawlListener {

    CrawlListener NONE = new CrawlListener() {
    };

    default void onFingerprint(BuildToolFingerprint fingerprint) {
    }

    default void onPageVisited(String url, String localPath, int pagesVisited) {
    }

    default void onAssetDiscovered(DiscoveredAsset asset) {
    }

    /**
     * The asset reached downloaded or failed.
     */
    default void onAssetSettled(DiscoveredAsset asset) {
    }

    default void onProgress(int settledAssets, int discoveredAssets) {
    }
}
