package com.example.procloner.service;

import java.io.IOException;

/**
 * Transient per-asset failure. Recorded on the asset, never aborts a crawl.
 */
public class AssetDownloadException extends IOException {

    public AssetDownloadException(String message) {
        super(message);
    }

    public AssetDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
