package com.example.procloner.service;

import com.example.procloner.model.AssetType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Extension and content-type helpers shared by the classifier and the path mapper.
 */
final class MediaTypes {

    private static final Map<String, String> EXT_BY_MIME = new HashMap<String, String>();

    static {
        EXT_BY_MIME.put("text/javascript", ".js");
        EXT_BY_MIME.put("application/javascript", ".js");
        EXT_BY_MIME.put("application/x-javascript", ".js");
        EXT_BY_MIME.put("text/css", ".css");
        EXT_BY_MIME.put("image/png", ".png");
        EXT_BY_MIME.put("image/jpeg", ".jpg");
        EXT_BY_MIME.put("image/jpg", ".jpg");
        EXT_BY_MIME.put("image/webp", ".webp");
        EXT_BY_MIME.put("image/svg+xml", ".svg");
        EXT_BY_MIME.put("image/gif", ".gif");
        EXT_BY_MIME.put("image/avif", ".avif");
        EXT_BY_MIME.put("image/x-icon", ".ico");
        EXT_BY_MIME.put("image/vnd.microsoft.icon", ".ico");
        EXT_BY_MIME.put("image/vnd.radiance", ".hdr");
        EXT_BY_MIME.put("image/x-exr", ".exr");
        EXT_BY_MIME.put("image/ktx", ".ktx");
        EXT_BY_MIME.put("image/ktx2", ".ktx2");
        EXT_BY_MIME.put("font/woff", ".woff");
        EXT_BY_MIME.put("font/woff2", ".woff2");
        EXT_BY_MIME.put("font/ttf", ".ttf");
        EXT_BY_MIME.put("font/otf", ".otf");
        EXT_BY_MIME.put("model/gltf-binary", ".glb");
        EXT_BY_MIME.put("model/gltf+json", ".gltf");
        EXT_BY_MIME.put("video/mp4", ".mp4");
        EXT_BY_MIME.put("video/webm", ".webm");
        EXT_BY_MIME.put("audio/mpeg", ".mp3");
        EXT_BY_MIME.put("audio/ogg", ".ogg");
        EXT_BY_MIME.put("audio/wav", ".wav");
        EXT_BY_MIME.put("application/json", ".json");
        EXT_BY_MIME.put("text/html", ".html");
        EXT_BY_MIME.put("text/xml", ".xml");
        EXT_BY_MIME.put("application/xml", ".xml");
    }

    private MediaTypes() {
    }

    /**
     * Lower-cased MIME type without parameters, or an empty string.
     */
    static String baseType(String contentType) {
        if (contentType == null) return "";
        String ct = contentType.trim().toLowerCase(Locale.ROOT);
        int semi = ct.indexOf(';');
        if (semi >= 0) ct = ct.substring(0, semi).trim();
        return ct;
    }

    static boolean isGeneric(String baseType) {
        return baseType.isEmpty()
                || "application/octet-stream".equals(baseType)
                || "binary/octet-stream".equals(baseType)
                || "application/binary".equals(baseType);
    }

    /**
     * Lower-cased extension of the URL's last path segment without the dot, or an empty string.
     */
    static String extensionOf(String url) {
        String name = lastSegment(url);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return "";
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Last path segment of a URL, without query or fragment. Empty for directory URLs.
     */
    static String lastSegment(String url) {
        if (url == null) return "";
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) path = path.substring(0, cut);
        int scheme = path.indexOf("://");
        if (scheme >= 0) {
            int firstSlash = path.indexOf('/', scheme + 3);
            path = firstSlash >= 0 ? path.substring(firstSlash) : "";
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    static String extensionForContentType(String contentType) {
        return EXT_BY_MIME.get(baseType(contentType));
    }

    static String extensionForType(AssetType type) {
        switch (type) {
            case JAVASCRIPT: return ".js";
            case STYLESHEET: return ".css";
            case IMAGE: return ".png";
            case FONT: return ".woff";
            case MODEL_3D: return ".glb";
            case AUDIO: return ".mp3";
            case VIDEO: return ".mp4";
            case HTML: return ".html";
            default: return ".bin";
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
