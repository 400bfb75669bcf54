package com.example.procloner.service;

import java.io.IOException;

/**
 * Network seam of the crawl engine. Implementations follow redirects, retry transient I/O
 * failures and return non-2xx responses instead of throwing.
 */
public interface ResourceFetcher {

    /**
     * @param url     absolute http(s) URL
     * @param referer page that referenced the resource, may be {@code null}
     * @throws IOException when the resource cannot be retrieved at all, including redirect loops
     */
    FetchedResource fetch(String url, String referer) throws IOException;
}
