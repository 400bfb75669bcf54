package com.example.procloner.model;

/**
 * Inbound push-channel message kinds.
 */
public enum ClientMessageType {
    RECOVER_SESSION("recover_session"),
    RESUME_SESSION("resume_session"),
    PAUSE_SESSION("pause_session"),
    CANCEL_SESSION("cancel_session");

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the matching type, or {@code null} for an unknown name
     */
    public static ClientMessageType fromWireName(String name) {
        if (name == null) return null;
        for (ClientMessageType t : values()) {
            if (t.wireName.equalsIgnoreCase(name.trim())) return t;
        }
        return null;
    }
}
