package com.example.procloner.event;

import com.example.procloner.model.CloneSession;
import com.example.procloner.model.DiscoveredAsset;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable push-channel event. Every event names its session so consumers never depend on
 * arrival order.
 */
public final class SessionEvent {

    private final String sessionId;
    private final EventType type;
    private final Map<String, Object> payload;
    private final Instant timestamp;

    public SessionEvent(String sessionId, EventType type, Map<String, Object> payload) {
        this.sessionId = sessionId;
        this.type = type;
        this.payload = payload == null
                ? Collections.<String, Object>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.timestamp = Instant.now();
    }

    public String getSessionId() { return sessionId; }
    public EventType getType() { return type; }
    public Map<String, Object> getPayload() { return payload; }
    public Instant getTimestamp() { return timestamp; }

    /**
     * Flattened wire form: {@code type}, {@code sessionId}, the payload fields and a timestamp.
     */
    public Map<String, Object> toFrame() {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type.wireName());
        if (sessionId != null) {
            frame.put("sessionId", sessionId);
        }
        frame.putAll(payload);
        frame.put("timestamp", timestamp.toString());
        return frame;
    }

    public static SessionEvent statusUpdate(CloneSession session) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("status", session.getStatus().value());
        p.put("progress", session.getProgress());
        p.put("totalAssets", session.getAssetCount());
        p.put("url", session.getUrl());
        if (session.getError() != null) {
            p.put("error", session.getError());
        }
        return new SessionEvent(session.getId(), EventType.STATUS_UPDATE, p);
    }

    public static SessionEvent progressUpdate(String sessionId, int progress, int totalAssets) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("progress", progress);
        p.put("totalAssets", totalAssets);
        return new SessionEvent(sessionId, EventType.PROGRESS_UPDATE, p);
    }

    public static SessionEvent assetFound(String sessionId, DiscoveredAsset asset) {
        Map<String, Object> p = new LinkedHashMap<>();
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("url", asset.getUrl());
        a.put("type", asset.getType().value());
        if (asset.getSubtype() != null) a.put("subtype", asset.getSubtype());
        a.put("localPath", asset.getLocalPath());
        a.put("size", asset.getSize());
        a.put("contentType", asset.getContentType());
        if (!asset.getFrameworkHints().isEmpty()) a.put("frameworkHints", asset.getFrameworkHints());
        p.put("asset", a);
        return new SessionEvent(sessionId, EventType.ASSET_FOUND, p);
    }

    public static SessionEvent of(String sessionId, EventType type) {
        return new SessionEvent(sessionId, type, null);
    }

    public static SessionEvent withMessage(String sessionId, EventType type, String key, Object value) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(key, value);
        return new SessionEvent(sessionId, type, p);
    }

    @Override
    public String toString() {
        return type.wireName() + "[" + sessionId + "]" + payload;
    }
}
