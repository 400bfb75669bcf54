package com.example.procloner.controller;

import com.example.procloner.service.IllegalSessionTransitionException;
import com.example.procloner.service.SessionCapacityExceededException;
import com.example.procloner.service.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    public static class ErrorResponse {
        private final String code;
        private final String message;
        private final OffsetDateTime timestamp;
        private final Map<String, Object> details;

        public ErrorResponse(String code, String message, Map<String, Object> details) {
            this.code = code;
            this.message = message;
            this.timestamp = OffsetDateTime.now();
            this.details = details;
        }

        public String getCode() { return code; }
        public String getMessage() { return message; }
        public OffsetDateTime getTimestamp() { return timestamp; }
        public Map<String, Object> getDetails() { return details; }
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("SESSION_NOT_FOUND", e.getMessage(), null));
    }

    @ExceptionHandler(IllegalSessionTransitionException.class)
    public ResponseEntity<ErrorResponse> handleIllegalTransition(IllegalSessionTransitionException e) {
        Map<String, Object> details = new HashMap<>();
        details.put("from", e.getFrom().value());
        details.put("to", e.getTo().value());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("ILLEGAL_TRANSITION", e.getMessage(), details));
    }

    @ExceptionHandler(SessionCapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacity(SessionCapacityExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ErrorResponse("TOO_MANY_SESSIONS", e.getMessage(), null));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgument(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        Map<String, Object> details = new HashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        details.put("message", e.getMessage());
        if (e.getCause() != null) {
            details.put("cause", e.getCause().getMessage());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", details));
    }
}
