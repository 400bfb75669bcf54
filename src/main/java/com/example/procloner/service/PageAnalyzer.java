package com.example.procloner.service;

import com.example.procloner.model.BuildToolSignals;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a parsed page: outgoing page links, referenced assets and the build-tool signals of
 * its markup.
 */
@Component
public class PageAnalyzer {

    private static final String[][] ASSET_ATTRIBUTES = {
            {"img[src]", "src"},
            {"img[data-src]", "data-src"},
            {"source[src]", "src"},
            {"video[src]", "src"},
            {"video[poster]", "poster"},
            {"audio[src]", "src"},
            {"track[src]", "src"},
            {"script[src]", "src"},
            {"link[rel~=(?i)stylesheet][href]", "href"},
            {"link[rel~=(?i)icon][href]", "href"},
            {"link[rel~=(?i)(preload|modulepreload|prefetch)][href]", "href"},
            {"link[rel~=(?i)manifest][href]", "href"},
            {"model-viewer[src]", "src"},
            {"model-viewer[environment-image]", "environment-image"},
            {"model-viewer[skybox-image]", "skybox-image"},
            {"a-asset-item[src]", "src"},
            {"object[data]", "data"},
            {"embed[src]", "src"},
            {"input[type=image][src]", "src"},
    };

    private final ReferenceExtractor references;

    public PageAnalyzer(ReferenceExtractor references) {
        this.references = references;
    }

    public static class PageScan {
        private final List<String> links;
        private final List<String> assets;
        private final BuildToolSignals signals;

        PageScan(List<String> links, List<String> assets, BuildToolSignals signals) {
            this.links = links;
            this.assets = assets;
            this.signals = signals;
        }

        public List<String> getLinks() { return links; }
        public List<String> getAssets() { return assets; }
        public BuildToolSignals getSignals() { return signals; }
    }

    public PageScan scan(Document doc) {
        String base = doc.location();
        Set<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href], area[href], iframe[src]")) {
            String attr = a.hasAttr("href") ? "href" : "src";
            String abs = ReferenceExtractor.resolve(a.attr(attr), base);
            if (abs != null) links.add(abs);
        }

        Set<String> assets = new LinkedHashSet<>();
        for (String[] selector : ASSET_ATTRIBUTES) {
            for (Element el : doc.select(selector[0])) {
                String abs = ReferenceExtractor.resolve(el.attr(selector[1]), base);
                if (abs != null) assets.add(abs);
            }
        }
        for (Element el : doc.select("[srcset]")) {
            for (String candidate : srcsetUrls(el.attr("srcset"))) {
                String abs = ReferenceExtractor.resolve(candidate, base);
                if (abs != null) assets.add(abs);
            }
        }
        for (Element el : doc.select("[style]")) {
            assets.addAll(references.cssReferences(el.attr("style"), base));
        }
        for (Element st : doc.select("style")) {
            assets.addAll(references.cssReferences(st.data(), base));
        }

        return new PageScan(new ArrayList<>(links), new ArrayList<>(assets), signals(doc));
    }

    /**
     * Markup-level toolchain evidence. Runtime globals are not visible without executing
     * scripts, so the flags rely on mount points, attributes and inline bootstrap code.
     */
    public BuildToolSignals signals(Document doc) {
        BuildToolSignals s = new BuildToolSignals();
        List<String> scripts = new ArrayList<>();
        for (Element script : doc.select("script[src]")) {
            String src = script.absUrl("src");
            scripts.add(src.isEmpty() ? script.attr("src") : src);
        }
        s.setScriptSources(scripts);

        List<String> generators = new ArrayList<>();
        for (Element meta : doc.select("meta[name=generator], meta[property=generator]")) {
            generators.add(meta.attr("content"));
        }
        s.setMetaGenerators(generators);

        String inline = inlineScripts(doc);

        s.setHasVue(!doc.select("#app, [data-v-app], [data-server-rendered]").isEmpty()
                || hasAttributePrefix(doc, "data-v-")
                || inline.contains("__VUE__") || inline.contains("Vue.createApp"));
        s.setHasReact(!doc.select("#root, [data-reactroot]").isEmpty()
                || inline.contains("__REACT_DEVTOOLS_GLOBAL_HOOK__") || inline.contains("ReactDOM"));
        s.setHasAngular(!doc.select("[ng-version], [ng-app], app-root").isEmpty());
        s.setHasWebpack(inline.contains("webpackJsonp") || inline.contains("webpackChunk")
                || inline.contains("__webpack_require__"));
        boolean viteScript = false;
        for (String src : scripts) {
            String lower = src.toLowerCase(Locale.ROOT);
            if (lower.contains("/@vite/") || lower.contains(".vite/")) viteScript = true;
        }
        s.setHasVite(viteScript);
        return s;
    }

    static List<String> srcsetUrls(String srcset) {
        List<String> urls = new ArrayList<>();
        if (srcset == null) return urls;
        for (String item : srcset.split(",")) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) continue;
            int sp = trimmed.indexOf(' ');
            urls.add(sp > 0 ? trimmed.substring(0, sp) : trimmed);
        }
        return urls;
    }

    private static String inlineScripts(Document doc) {
        StringBuilder sb = new StringBuilder();
        for (Element script : doc.select("script:not([src])")) {
            sb.append(script.data()).append('\n');
        }
        return sb.toString();
    }

    private static boolean hasAttributePrefix(Document doc, String prefix) {
        return !doc.select("[^" + prefix + "]").isEmpty();
    }
}
