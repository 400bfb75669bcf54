package com.example.procloner.service;

public class SessionCapacityExceededException extends RuntimeException {

    public SessionCapacityExceededException(int limit) {
        super("Too many concurrent sessions (limit " + limit + ")");
    }
}
