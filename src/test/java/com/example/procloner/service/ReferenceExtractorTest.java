package com.example.procloner.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceExtractorTest {

    private static final String BASE = "https://site.test/css/main.css";

    private final ReferenceExtractor extractor = new ReferenceExtractor();

    @Test
    void resolveKeepsEscapedDelimiters() {
        assertThat(ReferenceExtractor.resolve("/img/a%2Fb.png?name=b%26c&x=1", BASE))
                .isEqualTo("https://site.test/img/a%2Fb.png?name=b%26c&x=1");
    }

    @Test
    void resolveDropsFragmentAndNormalises() {
        assertThat(ReferenceExtractor.resolve("../fonts/./icons.woff2#iefix", BASE))
                .isEqualTo("https://site.test/fonts/icons.woff2");
        assertThat(ReferenceExtractor.resolve("//cdn.test/lib.js", BASE)).isEqualTo("https://cdn.test/lib.js");
        assertThat(ReferenceExtractor.resolve("my image.png", BASE)).isEqualTo("https://site.test/css/my%20image.png");
    }

    @Test
    void resolveSkipsNonFetchableReferences() {
        assertThat(ReferenceExtractor.resolve("data:image/png;base64,AAAA", BASE)).isNull();
        assertThat(ReferenceExtractor.resolve("javascript:void(0)", BASE)).isNull();
        assertThat(ReferenceExtractor.resolve("#top", BASE)).isNull();
        assertThat(ReferenceExtractor.resolve("  ", BASE)).isNull();
    }

    @Test
    void cssReferencesIncludeImports() {
        String css = "@import 'reset.css'; body { background: url(\"../img/bg.jpg\"); }";

        assertThat(extractor.cssReferences(css, BASE))
                .containsExactly("https://site.test/img/bg.jpg", "https://site.test/css/reset.css");
    }

    @Test
    void scriptReferencesFindQuotedAssets() {
        String js = "loader.load('/models/robot.glb'); new THREE.Scene(); fetch('/api/data.json');";

        assertThat(extractor.scriptReferences(js, "https://site.test/js/app.js"))
                .containsExactly("https://site.test/models/robot.glb");
        assertThat(extractor.frameworkHints(js)).containsExactly("Three.js");
    }
}
