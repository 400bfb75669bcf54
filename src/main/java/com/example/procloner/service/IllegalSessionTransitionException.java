package com.example.procloner.service;

import com.example.procloner.model.SessionStatus;

public class IllegalSessionTransitionException extends IllegalStateException {

    private final String sessionId;
    private final SessionStatus from;
    private final SessionStatus to;

    public IllegalSessionTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("Session " + sessionId + " cannot move from " + from.value() + " to " + to.value());
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public String getSessionId() { return sessionId; }
    public SessionStatus getFrom() { return from; }
    public SessionStatus getTo() { return to; }
}
