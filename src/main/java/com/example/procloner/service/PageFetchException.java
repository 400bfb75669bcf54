package com.example.procloner.service;

import java.io.IOException;

/**
 * A page could not be fetched in a way that makes the whole session fail: root page
 * unreachable, non-2xx root response, redirect loop.
 */
public class PageFetchException extends IOException {

    private final String url;

    public PageFetchException(String url, String message) {
        super(message);
        this.url = url;
    }

    public PageFetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
