package com.example.procloner.service;

/**
 * A resume request that could not be honoured. The session stays interrupted.
 */
public class ResumeFailedException extends RuntimeException {

    private final String sessionId;

    public ResumeFailedException(String sessionId, String reason) {
        super(reason);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
