package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Packaging targets requested by the client. Packaging itself happens downstream; the core
 * only carries the selection through to the terminal result.
 */
public enum ExportFormat {
    ZIP, GITHUB, VSCODE, DOCKER, NETLIFY;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ExportFormat fromValue(String value) {
        return ExportFormat.valueOf(value.trim().toUpperCase());
    }
}
