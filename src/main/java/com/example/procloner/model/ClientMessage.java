package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Raw inbound push-channel frame. Kept as strings so malformed frames can be rejected with a
 * typed reply instead of a deserialization error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMessage {

    private String type;
    private String sessionId;

    public ClientMessage() {
    }

    public ClientMessage(String type, String sessionId) {
        this.type = type;
        this.sessionId = sessionId;
    }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
}
