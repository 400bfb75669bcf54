package com.example.procloner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Frontend toolchains the detector can recognise.
 * <p>
 * {@code threshold} is the minimum confidence a detector must report for a match to count.
 * {@code specificity} breaks confidence ties: bundler-level tools outrank framework-level
 * ones because one framework can be hosted by several bundlers. The webpack and angular-cli
 * thresholds are provisional.
 */
public enum BuildTool {
    VITE("vite", 0.9, 3),
    WEBPACK("webpack", 0.8, 2),
    VUE_CLI("vue-cli", 0.8, 1),
    CREATE_REACT_APP("create-react-app", 0.8, 1),
    ANGULAR_CLI("angular-cli", 0.8, 1),
    UNKNOWN("unknown", 0.0, 0);

    private final String value;
    private final double threshold;
    private final int specificity;

    BuildTool(String value, double threshold, int specificity) {
        this.value = value;
        this.threshold = threshold;
        this.specificity = specificity;
    }

    @JsonValue
    public String value() { return value; }

    public double threshold() { return threshold; }

    public int specificity() { return specificity; }

    @JsonCreator
    public static BuildTool fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (BuildTool t : values()) {
            if (t.value.equalsIgnoreCase(value.trim())) return t;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
