package com.example.procloner.service;

import java.util.Arrays;

/**
 * A completed HTTP exchange: final URL after redirects, status, content type and body.
 */
public class FetchedResource {

    private final String url;
    private final int statusCode;
    private final String contentType;
    private final byte[] body;

    public FetchedResource(String url, int statusCode, String contentType, byte[] body) {
        this.url = url;
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.body = body == null ? new byte[0] : body;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public byte[] getBody() { return body; }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public byte[] sample(int max) {
        return Arrays.copyOf(body, Math.min(max, body.length));
    }
}
