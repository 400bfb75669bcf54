package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Detected toolchain identity. Immutable: a session freezes one fingerprint and keeps it.
 * {@link BuildTool#UNKNOWN} always carries confidence 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BuildToolFingerprint {

    private static final BuildToolFingerprint UNKNOWN =
            new BuildToolFingerprint(BuildTool.UNKNOWN, 0.0, Collections.<String>emptyList());

    private final BuildTool tool;
    private final double confidence;
    private final List<String> signals;

    @JsonCreator
    public BuildToolFingerprint(@JsonProperty("tool") BuildTool tool,
                                @JsonProperty("confidence") double confidence,
                                @JsonProperty("signals") List<String> signals) {
        this.tool = tool == null ? BuildTool.UNKNOWN : tool;
        this.confidence = this.tool == BuildTool.UNKNOWN ? 0.0 : confidence;
        this.signals = signals == null
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(signals));
    }

    public static BuildToolFingerprint unknown() {
        return UNKNOWN;
    }

    public BuildTool getTool() { return tool; }
    public double getConfidence() { return confidence; }
    public List<String> getSignals() { return signals; }

    @Override
    public String toString() {
        return tool.value() + "(" + confidence + ")";
    }
}
