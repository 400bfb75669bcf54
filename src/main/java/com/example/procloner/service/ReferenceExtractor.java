package com.example.procloner.service;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds further asset references inside downloaded stylesheets and scripts, and the 3D
 * runtimes a script uses.
 */
@Component
public class ReferenceExtractor {

    static final Pattern CSS_URL_PATTERN = Pattern.compile("url\\(\\s*(['\"]?)([^)'\"]+)\\1\\s*\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern CSS_IMPORT_PATTERN = Pattern.compile("@import\\s+(['\"])([^'\"]+)\\1", Pattern.CASE_INSENSITIVE);

    private static final Pattern JS_ASSET_PATTERN = Pattern.compile(
            "['\"`]([^'\"`\\s<>]+\\.(?:glb|gltf|obj|fbx|hdr|exr|ktx2?|basis|jpe?g|png|gif|webp|mp4|webm|mov|avi|mp3|wav|ogg|woff2?|ttf|otf))(?:\\?[^'\"`\\s<>]*)?['\"`]",
            Pattern.CASE_INSENSITIVE);

    /**
     * Absolute URLs referenced through {@code url(...)} and {@code @import} in a stylesheet.
     */
    public List<String> cssReferences(String css, String baseUrl) {
        Set<String> refs = new LinkedHashSet<>();
        if (css == null || css.isEmpty()) return new ArrayList<>(refs);
        Matcher m = CSS_URL_PATTERN.matcher(css);
        while (m.find()) {
            addResolved(refs, m.group(2), baseUrl);
        }
        Matcher imports = CSS_IMPORT_PATTERN.matcher(css);
        while (imports.find()) {
            addResolved(refs, imports.group(2), baseUrl);
        }
        return new ArrayList<>(refs);
    }

    /**
     * Absolute URLs of models, environment maps, textures, media and fonts quoted in a script.
     */
    public List<String> scriptReferences(String js, String baseUrl) {
        Set<String> refs = new LinkedHashSet<>();
        if (js == null || js.isEmpty()) return new ArrayList<>(refs);
        Matcher m = JS_ASSET_PATTERN.matcher(js);
        while (m.find()) {
            String raw = m.group(1).replace("\\/", "/");
            if (raw.startsWith("http://") || raw.startsWith("https://") || raw.startsWith("/")
                    || raw.startsWith("./") || raw.startsWith("../") || raw.matches("^[A-Za-z0-9_-][^:]*$")) {
                addResolved(refs, raw, baseUrl);
            }
        }
        return new ArrayList<>(refs);
    }

    public List<String> frameworkHints(String js) {
        List<String> hints = new ArrayList<>();
        if (js == null || js.isEmpty()) return hints;
        if (js.contains("THREE.") || js.contains("three.js") || js.contains("three.module")) hints.add("Three.js");
        if (js.contains("BABYLON.") || js.contains("babylon.js")) hints.add("Babylon.js");
        if (js.contains("A-Frame") || js.toLowerCase(Locale.ROOT).contains("aframe")) hints.add("A-Frame");
        if (js.contains("PlayCanvas") || js.contains("pc.Application")) hints.add("PlayCanvas");
        if (js.contains("WebGL") || js.contains("getContext(\"webgl") || js.contains("getContext('webgl")) hints.add("WebGL");
        return hints;
    }

    /**
     * Resolves a raw reference against its base. Returns {@code null} for references that name
     * no fetchable resource (data, javascript, mailto, tel, blob, bare fragments).
     */
    public static String resolve(String raw, String baseUrl) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) return null;
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data:") || lower.startsWith("javascript:") || lower.startsWith("mailto:")
                || lower.startsWith("tel:") || lower.startsWith("blob:") || lower.startsWith("about:")) {
            return null;
        }
        try {
            URI abs;
            if (trimmed.startsWith("//")) {
                String scheme = baseUrl == null ? "https" : URI.create(baseUrl).getScheme();
                abs = new URI(scheme + ":" + trimmed);
            } else if (baseUrl == null) {
                abs = new URI(trimmed);
            } else {
                abs = URI.create(baseUrl).resolve(trimmed.replace(" ", "%20"));
            }
            abs = abs.normalize();
            if (abs.getScheme() == null) return null;
            return withoutFragment(abs);
        } catch (Exception e) {
            return null;
        }
    }

    // rebuilt from the raw components so escapes such as %2F and %26 keep their meaning
    private static String withoutFragment(URI uri) {
        if (uri.isOpaque()) {
            return uri.getScheme() + ":" + uri.getRawSchemeSpecificPart();
        }
        StringBuilder sb = new StringBuilder(uri.getScheme()).append(':');
        if (uri.getRawAuthority() != null) sb.append("//").append(uri.getRawAuthority());
        if (uri.getRawPath() != null) sb.append(uri.getRawPath());
        if (uri.getRawQuery() != null) sb.append('?').append(uri.getRawQuery());
        return sb.toString();
    }

    private static void addResolved(Set<String> refs, String raw, String baseUrl) {
        String abs = resolve(raw, baseUrl);
        if (abs != null) refs.add(abs);
    }
}
