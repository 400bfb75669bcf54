package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed asset taxonomy. The wire value is also the bucket directory name used by the
 * fallback path convention ({@code assets/<value>/<filename>}).
 */
public enum AssetType {
    MODEL_3D("3d-model"),
    ENVIRONMENT_MAP("environment-map"),
    TEXTURE("texture"),
    VIDEO("video"),
    AUDIO("audio"),
    IMAGE("image"),
    JAVASCRIPT("javascript"),
    STYLESHEET("stylesheet"),
    HTML("html"),
    FONT("font"),
    OTHER("other");

    private final String value;

    AssetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AssetType fromValue(String value) {
        if (value == null) return null;
        for (AssetType t : values()) {
            if (t.value.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim())) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown asset type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
