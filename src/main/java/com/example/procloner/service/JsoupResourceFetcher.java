package com.example.procloner.service;

import com.example.procloner.config.CrawlProperties;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.HashSet;
import java.util.Set;

/**
 * Fetches pages and assets with Jsoup. Redirects are followed by hand so loops and overlong
 * chains are reported; transient I/O errors and truncated bodies are retried with a linear
 * back-off. Malformed URLs surface as {@link AssetDownloadException}.
 */
@Component
public class JsoupResourceFetcher implements ResourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupResourceFetcher.class);

    private static final long BACKOFF_MS = 500L;

    private final CrawlProperties properties;

    public JsoupResourceFetcher(CrawlProperties properties) {
        this.properties = properties;
    }

    @Override
    public FetchedResource fetch(String url, String referer) throws IOException {
        int attempts = 0;
        IOException last = null;
        int maxAttempts = Math.max(1, properties.getRetryAttempts());
        while (attempts < maxAttempts) {
            attempts++;
            try {
                return followRedirects(url, referer);
            } catch (TruncatedBodyException ex) {
                last = ex;
            } catch (RedirectException | AssetDownloadException ex) {
                // retrying cannot fix these
                throw ex;
            } catch (IOException ex) {
                last = ex;
            } catch (UncheckedIOException ex) {
                // jsoup wraps read failures while buffering the body
                last = ex.getCause();
            } catch (IllegalArgumentException ex) {
                throw new AssetDownloadException("Cannot fetch " + url + ": " + ex.getMessage(), ex);
            }
            log.debug("[FETCH] attempt {} failed for {}: {}", attempts, url, last.getMessage());
            if (attempts < maxAttempts) {
                backOff(attempts, url);
            }
        }
        throw last == null ? new IOException("Unknown download error") : last;
    }

    private static void backOff(int attempts, String url) throws InterruptedIOException {
        try {
            Thread.sleep(BACKOFF_MS * attempts);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while retrying " + url);
        }
    }

    private FetchedResource followRedirects(String url, String referer) throws IOException {
        Set<String> seen = new HashSet<>();
        String current = url;
        for (int hop = 0; hop <= properties.getMaxRedirects(); hop++) {
            if (!seen.add(current)) {
                throw new RedirectException("Redirect loop at " + current);
            }
            Connection.Response res = execute(current, referer);
            int status = res.statusCode();
            String location = res.header("Location");
            if (status >= 300 && status < 400 && location != null && !location.trim().isEmpty()) {
                current = redirectTarget(current, location.trim());
                continue;
            }
            byte[] body = res.bodyAsBytes();
            if (body.length >= maxBodySize() && maxBodySize() < Integer.MAX_VALUE) {
                throw new AssetDownloadException("Response exceeds " + properties.getMaxAssetBytes() + " bytes");
            }
            long expected = declaredLength(res);
            if (expected >= 0 && expected != body.length) {
                throw new TruncatedBodyException("Truncated body from " + current + ": got " + body.length
                        + " of " + expected + " bytes");
            }
            return new FetchedResource(res.url().toString(), status, res.contentType(), body);
        }
        throw new RedirectException("Too many redirects (>" + properties.getMaxRedirects() + ") from " + url);
    }

    private Connection.Response execute(String url, String referer) throws IOException {
        return Jsoup.connect(url)
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .followRedirects(false)
                .timeout((int) properties.getRequestTimeout().toMillis())
                .header("Referer", referer == null ? url : referer)
                .userAgent(properties.getUserAgent())
                .maxBodySize(maxBodySize())
                .execute();
    }

    private static String redirectTarget(String current, String location) throws RedirectException {
        try {
            return URI.create(current).resolve(location).toString();
        } catch (IllegalArgumentException e) {
            throw new RedirectException("Malformed redirect location '" + location + "' from " + current);
        }
    }

    // -1 when absent or when the body was decoded from a content encoding
    private static long declaredLength(Connection.Response res) {
        String encoding = res.header("Content-Encoding");
        if (encoding != null && !"identity".equalsIgnoreCase(encoding.trim())) return -1L;
        String length = res.header("Content-Length");
        if (length == null) return -1L;
        try {
            return Long.parseLong(length.trim());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private int maxBodySize() {
        long max = properties.getMaxAssetBytes();
        return max <= 0 || max >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) max;
    }

    static class RedirectException extends IOException {
        RedirectException(String message) {
            super(message);
        }
    }

    static class TruncatedBodyException extends AssetDownloadException {
        TruncatedBodyException(String message) {
            super(message);
        }
    }
}
