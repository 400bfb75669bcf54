package com.example.procloner.service;

import com.example.procloner.event.ChannelReply;
import com.example.procloner.model.ClientMessage;
import com.example.procloner.model.ClientMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Single entry point for inbound channel messages. Malformed messages are answered with
 * {@code request_rejected} and never touch session state.
 */
@Component
public class ChannelMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(ChannelMessageRouter.class);

    private final RecoveryProtocolHandler handler;

    public ChannelMessageRouter(RecoveryProtocolHandler handler) {
        this.handler = handler;
    }

    public ChannelReply route(ClientMessage message) {
        if (message == null || message.getType() == null || message.getType().trim().isEmpty()) {
            return reject(null, "Missing message type");
        }
        ClientMessageType type = ClientMessageType.fromWireName(message.getType());
        if (type == null) {
            return reject(null, "Unknown message type: " + message.getType());
        }
        String sessionId = normalizeSessionId(message.getSessionId());
        if (sessionId == null) {
            return reject(null, "Invalid session id: " + message.getSessionId());
        }
        log.debug("[CHANNEL] {} for {}", type.wireName(), sessionId);
        switch (type) {
            case RECOVER_SESSION:
                return handler.recover(sessionId);
            case RESUME_SESSION:
                return handler.resume(sessionId);
            case PAUSE_SESSION:
                return handler.pause(sessionId);
            case CANCEL_SESSION:
                return handler.cancel(sessionId);
            default:
                return reject(sessionId, "Unsupported message type: " + type.wireName());
        }
    }

    /**
     * @return the canonical lowercase UUID, or {@code null} when the value is not one
     */
    static String normalizeSessionId(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        if (trimmed.length() != 36) return null;
        try {
            return UUID.fromString(trimmed).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static ChannelReply reject(String sessionId, String reason) {
        log.info("[CHANNEL] rejected message: {}", reason);
        return ChannelReply.of(RecoveryProtocolHandler.rejected(sessionId, reason));
    }
}
