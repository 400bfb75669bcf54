package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DownloadStatus {
    PENDING,
    DOWNLOADED,
    FAILED,
    // in flight when the session was cancelled, paused or timed out
    ABANDONED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
