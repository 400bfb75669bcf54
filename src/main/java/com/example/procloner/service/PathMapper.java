package com.example.procloner.service;

import com.example.procloner.model.AssetType;
import com.example.procloner.model.BuildTool;

import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps source URLs to output-relative paths under one session's frozen build tool.
 * <p>
 * {@link #targetPath} is pure. {@link #assign} records the first path computed for a URL and
 * never recomputes it; a second URL landing on a taken path gets a {@code _N} suffix so the
 * table stays a bijection. The table is shared with the session's crawl state and every
 * mutation holds its monitor.
 */
public class PathMapper {

    private static final AssetClassifier EXTENSION_CLASSIFIER = new AssetClassifier();

    private final BuildTool tool;
    private final PathConventions.Convention convention;
    private final Map<String, String> table;
    private final Set<String> taken = new HashSet<>();

    public PathMapper(BuildTool tool, Map<String, String> table) {
        this.tool = tool == null ? BuildTool.UNKNOWN : tool;
        this.convention = PathConventions.forTool(this.tool);
        this.table = table;
        synchronized (table) {
            taken.addAll(table.values());
        }
    }

    public BuildTool getTool() {
        return tool;
    }

    public String targetPath(String sourceUrl, AssetType type) {
        return targetPath(sourceUrl, type, null);
    }

    public String targetPath(String sourceUrl, AssetType type, String contentType) {
        AssetType t = type == null ? AssetType.OTHER : type;
        String preserved = preservedPath(sourceUrl);
        if (preserved != null) {
            return preserved;
        }
        return convention.directoryFor(t) + fileName(sourceUrl, t, contentType);
    }

    /**
     * Already-assigned path for a URL, or one computed from its extension and cached.
     */
    public String localPath(String sourceUrl) {
        String existing = lookup(sourceUrl);
        if (existing != null) return existing;
        AssetType type = guessType(sourceUrl);
        return assign(sourceUrl, type, null);
    }

    public String lookup(String sourceUrl) {
        synchronized (table) {
            return table.get(sourceUrl);
        }
    }

    public String assign(String sourceUrl, AssetType type, String contentType) {
        synchronized (table) {
            String existing = table.get(sourceUrl);
            if (existing != null) return existing;
            return claim(sourceUrl, targetPath(sourceUrl, type, contentType));
        }
    }

    /**
     * Claims an output path for a file derived from a source URL, such as a resized image.
     * The key is {@code sourceUrl#variant}, which no crawled URL can collide with because
     * fragments are stripped on discovery.
     */
    public String assignVariant(String sourceUrl, String variant, String candidatePath) {
        String key = sourceUrl + "#" + variant;
        synchronized (table) {
            String existing = table.get(key);
            if (existing != null) return existing;
            return claim(key, candidatePath);
        }
    }

    /**
     * Local path for a crawled page: directory URLs become {@code index.html}, extension-less
     * names get {@code .html}, a query string is folded into the name.
     */
    public String assignPage(String pageUrl) {
        synchronized (table) {
            String existing = table.get(pageUrl);
            if (existing != null) return existing;
            return claim(pageUrl, pagePath(pageUrl));
        }
    }

    public int size() {
        synchronized (table) {
            return table.size();
        }
    }

    /**
     * Relative reference from one output file to another, with forward slashes.
     */
    public static String relativize(String fromFile, String toFile) {
        Path from = Paths.get(fromFile).getParent();
        Path target = Paths.get(toFile);
        String rel = from == null ? target.toString() : from.relativize(target).toString();
        return rel.replace('\\', '/');
    }

    private String claim(String sourceUrl, String candidate) {
        String path = candidate;
        int counter = 1;
        while (taken.contains(path)) {
            path = withSuffix(candidate, counter++);
        }
        taken.add(path);
        table.put(sourceUrl, path);
        return path;
    }

    private String preservedPath(String sourceUrl) {
        String prefix = convention.getPreservedPrefix();
        if (prefix == null) return null;
        String path = urlPath(sourceUrl);
        if (path == null || !path.startsWith("/" + prefix) || path.endsWith("/")) return null;
        String[] parts = path.substring(1).split("/");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty() || ".".equals(part) || "..".equals(part)) continue;
            if (sb.length() > 0) sb.append('/');
            sb.append(sanitizeFileName(part));
        }
        return sb.toString();
    }

    static String fileName(String sourceUrl, AssetType type, String contentType) {
        String raw = sanitizeFileName(MediaTypes.lastSegment(sourceUrl));
        String stripped = raw.replace(".", "").replace("-", "").replace("_", "");
        if (stripped.isEmpty()) {
            raw = "asset-" + Integer.toHexString(sourceUrl == null ? 0 : sourceUrl.hashCode());
        }
        if (raw.lastIndexOf('.') <= 0) {
            String ext = MediaTypes.extensionForContentType(contentType);
            raw = raw + (ext != null ? ext : MediaTypes.extensionForType(type));
        }
        return raw;
    }

    static String pagePath(String pageUrl) {
        String rawPath = urlPath(pageUrl);
        if (rawPath == null || rawPath.trim().isEmpty()) rawPath = "/";
        String[] parts = rawPath.split("/", -1);
        StringBuilder sb = new StringBuilder();
        String last = "index.html";
        for (int i = 0; i < parts.length; i++) {
            String seg = parts[i];
            boolean isLast = i == parts.length - 1;
            if (isLast) {
                if (!seg.isEmpty()) {
                    last = sanitizeFileName(seg);
                    if (!last.contains(".")) last = last + ".html";
                }
                break;
            }
            if (seg.isEmpty() || ".".equals(seg) || "..".equals(seg)) continue;
            sb.append(sanitizeFileName(seg)).append('/');
        }
        String query = urlQuery(pageUrl);
        if (query != null && !query.trim().isEmpty()) {
            String suffix = "_q_" + sanitizeFileName(query);
            int dot = last.lastIndexOf('.');
            last = dot > 0 ? last.substring(0, dot) + suffix + last.substring(dot) : last + suffix + ".html";
        }
        return sb.append(last).toString();
    }

    private static AssetType guessType(String url) {
        String ext = MediaTypes.extensionOf(url);
        if (ext.isEmpty()) return AssetType.OTHER;
        return EXTENSION_CLASSIFIER.classifyByUrl(url).getType();
    }

    private static String withSuffix(String path, int n) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot > slash + 1) {
            return path.substring(0, dot) + "_" + n + path.substring(dot);
        }
        return path + "_" + n;
    }

    private static String urlPath(String url) {
        try {
            return new URI(url).getRawPath();
        } catch (Exception e) {
            return null;
        }
    }

    private static String urlQuery(String url) {
        try {
            return new URI(url).getRawQuery();
        } catch (Exception e) {
            return null;
        }
    }

    static String sanitizeFileName(String name) {
        try {
            String decoded = URLDecoder.decode(name, "UTF-8");
            return decoded.replaceAll("[^a-zA-Z0-9._-]", "-");
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            return name.replaceAll("[^a-zA-Z0-9._-]", "-");
        }
    }
}
