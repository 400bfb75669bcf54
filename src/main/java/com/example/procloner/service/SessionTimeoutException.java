package com.example.procloner.service;

import java.io.IOException;

/**
 * The session deadline passed while work that does not poll a stop flag was running.
 */
public class SessionTimeoutException extends IOException {

    public SessionTimeoutException(String message) {
        super(message);
    }
}
