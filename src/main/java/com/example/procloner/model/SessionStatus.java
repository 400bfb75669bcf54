package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a clone session. {@code STARTING} is the only initial state;
 * {@code COMPLETED}, {@code ERROR} and {@code TIMEOUT} are terminal.
 */
public enum SessionStatus {
    STARTING,
    CRAWLING,
    PROCESSING,
    COMPLETED,
    ERROR,
    TIMEOUT,
    INTERRUPTED,
    RESUMING;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == TIMEOUT;
    }

    // an execution owns the session in these states
    public boolean isActive() {
        return this == STARTING || this == CRAWLING || this == PROCESSING || this == RESUMING;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        return SessionStatus.valueOf(value.trim().toUpperCase());
    }
}
