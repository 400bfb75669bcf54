package com.example.procloner.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outbound push-channel frame kinds.
 */
public enum EventType {
    STATUS_UPDATE("status_update"),
    PROGRESS_UPDATE("progress_update"),
    ASSET_FOUND("asset_found"),
    CONNECTION_STATUS("connection_status"),
    SESSION_NOT_FOUND("session_not_found"),
    SESSION_RECOVERY_AVAILABLE("session_recovery_available"),
    SESSION_RESUMED("session_resumed"),
    SESSION_RESUME_FAILED("session_resume_failed"),
    REQUEST_REJECTED("request_rejected");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    // replies to one client; not kept in the activity history
    public boolean isReplyOnly() {
        return this == CONNECTION_STATUS || this == SESSION_NOT_FOUND || this == REQUEST_REJECTED;
    }
}
