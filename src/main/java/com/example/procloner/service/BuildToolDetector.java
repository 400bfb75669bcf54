package com.example.procloner.service;

import com.example.procloner.model.BuildTool;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.BuildToolSignals;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Infers the frontend toolchain from entry-page signals.
 * <p>
 * Each tool has its own detector. A detector's claim counts only at or above the tool's
 * threshold. The highest confidence wins; ties go to the more specific toolchain (bundler
 * over framework), then to declaration order. No claim yields {@code unknown} with
 * confidence 0.
 */
@Component
public class BuildToolDetector {

    interface Detector {
        BuildTool tool();

        /**
         * @return the confidence, or 0 when the signals do not match
         */
        double score(BuildToolSignals signals, List<String> evidence);
    }

    private final List<Detector> detectors = new ArrayList<>();

    public BuildToolDetector() {
        detectors.add(new ViteDetector());
        detectors.add(new WebpackDetector());
        detectors.add(new VueCliDetector());
        detectors.add(new CreateReactAppDetector());
        detectors.add(new AngularCliDetector());
    }

    public BuildToolFingerprint analyze(BuildToolSignals signals) {
        if (signals == null) {
            return BuildToolFingerprint.unknown();
        }
        BuildTool best = BuildTool.UNKNOWN;
        double bestConfidence = 0.0;
        List<String> bestEvidence = new ArrayList<>();
        for (Detector detector : detectors) {
            List<String> evidence = new ArrayList<>();
            double confidence = detector.score(signals, evidence);
            if (confidence < detector.tool().threshold() || confidence <= 0.0) {
                continue;
            }
            if (confidence > bestConfidence
                    || (confidence == bestConfidence && detector.tool().specificity() > best.specificity())) {
                best = detector.tool();
                bestConfidence = confidence;
                bestEvidence = evidence;
            }
        }
        if (best == BuildTool.UNKNOWN) {
            return BuildToolFingerprint.unknown();
        }
        return new BuildToolFingerprint(best, bestConfidence, bestEvidence);
    }

    static final class ViteDetector implements Detector {
        public BuildTool tool() { return BuildTool.VITE; }

        public double score(BuildToolSignals s, List<String> evidence) {
            // the dev-server client script is conclusive on its own
            if (s.anyScriptContains("/@vite/client")) {
                evidence.add("script:/@vite/client");
                return 0.95;
            }
            if (s.anyGeneratorContains("vite")) {
                evidence.add("meta:generator=vite");
                return 0.92;
            }
            if (s.isHasVite() || s.anyScriptContains("/@vite/", ".vite/")) {
                evidence.add(s.isHasVite() ? "flag:hasVite" : "script:/@vite/");
                return 0.92;
            }
            return 0.0;
        }
    }

    // provisional confidence: not covered by reference signal sets
    static final class WebpackDetector implements Detector {
        public BuildTool tool() { return BuildTool.WEBPACK; }

        public double score(BuildToolSignals s, List<String> evidence) {
            if (s.isHasWebpack()) {
                evidence.add("flag:hasWebpack");
                return 0.8;
            }
            if (s.anyGeneratorContains("webpack") || s.anyScriptContains("webpack", "runtime~", "vendors~")) {
                evidence.add("script:webpack-runtime");
                return 0.8;
            }
            return 0.0;
        }
    }

    static final class VueCliDetector implements Detector {
        public BuildTool tool() { return BuildTool.VUE_CLI; }

        public double score(BuildToolSignals s, List<String> evidence) {
            if (!s.isHasVue()) return 0.0;
            evidence.add("flag:hasVue");
            if (s.anyScriptContains("chunk-vendors") || appBundle(s)) {
                evidence.add("script:vue-cli-chunks");
                return 0.9;
            }
            return 0.8;
        }

        private static boolean appBundle(BuildToolSignals s) {
            for (String src : s.getScriptSources()) {
                if (src == null) continue;
                String name = MediaTypes.lastSegment(src.toLowerCase());
                if (name.startsWith("app.") && name.endsWith(".js")) return true;
            }
            return false;
        }
    }

    static final class CreateReactAppDetector implements Detector {
        public BuildTool tool() { return BuildTool.CREATE_REACT_APP; }

        public double score(BuildToolSignals s, List<String> evidence) {
            if (!s.isHasReact()) return 0.0;
            evidence.add("flag:hasReact");
            if (s.anyScriptContains("static/js/", "runtime-main", "chunk.js")) {
                evidence.add("script:cra-chunks");
                return 0.9;
            }
            return 0.8;
        }
    }

    static final class AngularCliDetector implements Detector {
        public BuildTool tool() { return BuildTool.ANGULAR_CLI; }

        public double score(BuildToolSignals s, List<String> evidence) {
            if (!s.isHasAngular()) return 0.0;
            evidence.add("flag:hasAngular");
            if (s.anyScriptContains("polyfills", "/main.", "runtime.")) {
                evidence.add("script:angular-bundles");
                return 0.9;
            }
            return 0.8;
        }
    }
}
