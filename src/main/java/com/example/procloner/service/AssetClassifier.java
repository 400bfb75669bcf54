package com.example.procloner.service;

import com.example.procloner.model.AssetClassification;
import com.example.procloner.model.AssetType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Assigns an asset type and subtype from the declared content type, the URL extension and a
 * short byte prefix.
 * <p>
 * An explicit content type wins; the extension decides when the content type is missing or
 * generic. Byte signatures only separate textures and environment maps from plain images and
 * catch 3D containers served as {@code application/octet-stream}. Never throws: anything
 * unrecognised is {@link AssetType#OTHER}.
 */
@Component
public class AssetClassifier {

    private static final Set<String> MODEL_EXT = set("glb", "gltf", "obj", "fbx", "usdz", "stl", "ply", "dae");
    private static final Set<String> ENV_EXT = set("hdr", "exr");
    private static final Set<String> TEXTURE_EXT = set("ktx", "ktx2", "dds", "basis");
    private static final Set<String> VIDEO_EXT = set("mp4", "webm", "mov", "avi", "ogv", "m4v");
    private static final Set<String> AUDIO_EXT = set("mp3", "wav", "ogg", "m4a", "aac", "flac");
    private static final Set<String> IMAGE_EXT = set("jpg", "jpeg", "png", "gif", "svg", "webp", "avif", "ico", "bmp");
    private static final Set<String> SCRIPT_EXT = set("js", "mjs", "cjs");
    private static final Set<String> HTML_EXT = set("html", "htm", "xhtml", "shtml");
    private static final Set<String> FONT_EXT = set("woff", "woff2", "ttf", "otf", "eot");

    private static final byte[] GLB_MAGIC = ascii("glTF");
    private static final byte[] KTX_MAGIC = {(byte) 0xAB, 'K', 'T', 'X', ' ', '1', '1', (byte) 0xBB};
    private static final byte[] KTX2_MAGIC = {(byte) 0xAB, 'K', 'T', 'X', ' ', '2', '0', (byte) 0xBB};
    private static final byte[] DDS_MAGIC = ascii("DDS ");
    private static final byte[] BASIS_MAGIC = ascii("sB");
    private static final byte[] RADIANCE_MAGIC = ascii("#?RADIANCE");
    private static final byte[] RGBE_MAGIC = ascii("#?RGBE");
    private static final byte[] EXR_MAGIC = {0x76, 0x2F, 0x31, 0x01};

    public AssetClassification classify(String url, String contentType, byte[] sample) {
        String ct = MediaTypes.baseType(contentType);
        String ext = MediaTypes.extensionOf(url);
        boolean generic = MediaTypes.isGeneric(ct);

        AssetType type = generic ? null : byContentType(ct, ext);
        if (type == null) {
            type = byExtension(ext);
        }

        AssetClassification sniffed = sniff(type, generic, sample);
        if (sniffed != null) {
            return sniffed;
        }

        String lowerUrl = url == null ? "" : url.toLowerCase(Locale.ROOT);
        String name = MediaTypes.lastSegment(lowerUrl);
        if ((type == AssetType.IMAGE || type == AssetType.OTHER) && lowerUrl.contains("envmap")) {
            return AssetClassification.of(AssetType.ENVIRONMENT_MAP, ext.isEmpty() ? null : ext);
        }
        if (type == AssetType.IMAGE && looksLikeTexture(name)) {
            return AssetClassification.of(AssetType.TEXTURE, textureKind(name));
        }
        if (type == AssetType.TEXTURE) {
            String kind = textureKind(name);
            return AssetClassification.of(type, "unknown".equals(kind) ? emptyToNull(ext) : kind);
        }
        return AssetClassification.of(type, subtypeFor(ct, ext));
    }

    public AssetClassification classifyByUrl(String url) {
        return classify(url, null, null);
    }

    /**
     * Material map kind from a texture filename. {@code unknown} when nothing matches.
     */
    public String textureKind(String filename) {
        String f = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        Set<String> tokens = new HashSet<>(Arrays.asList(f.split("[^a-z0-9]+")));
        if (f.contains("normal") || tokens.contains("norm") || tokens.contains("nrm")) return "normal";
        if (f.contains("diffuse") || f.contains("albedo") || f.contains("basecolor")) return "diffuse";
        if (f.contains("specular") || tokens.contains("spec")) return "specular";
        if (f.contains("roughness") || tokens.contains("rough")) return "roughness";
        if (f.contains("metallic") || f.contains("metalness") || tokens.contains("metal")) return "metallic";
        if (f.contains("emission") || f.contains("emissive")) return "emission";
        if (f.contains("height") || f.contains("displacement")) return "height";
        if (f.contains("ambient") || f.contains("occlusion") || tokens.contains("ao")) return "ambient-occlusion";
        if (f.contains("envmap") || f.contains("environment")) return "environment";
        return "unknown";
    }

    private AssetType byContentType(String ct, String ext) {
        if (ct.startsWith("model/")) return AssetType.MODEL_3D;
        if ("image/vnd.radiance".equals(ct) || "image/x-exr".equals(ct) || "image/aces".equals(ct)) {
            return AssetType.ENVIRONMENT_MAP;
        }
        if ("image/ktx".equals(ct) || "image/ktx2".equals(ct) || "image/vnd-ms.dds".equals(ct) || "image/x-dds".equals(ct)) {
            return AssetType.TEXTURE;
        }
        if (ct.startsWith("image/")) return AssetType.IMAGE;
        if (ct.startsWith("video/")) return AssetType.VIDEO;
        if (ct.startsWith("audio/")) return AssetType.AUDIO;
        if (ct.contains("javascript") || ct.contains("ecmascript")) return AssetType.JAVASCRIPT;
        if ("text/css".equals(ct)) return AssetType.STYLESHEET;
        if ("text/html".equals(ct) || "application/xhtml+xml".equals(ct)) return AssetType.HTML;
        if (ct.startsWith("font/") || ct.startsWith("application/font-") || ct.startsWith("application/x-font")
                || "application/vnd.ms-fontobject".equals(ct)) {
            return AssetType.FONT;
        }
        // json, text/plain and friends say nothing useful; let the extension decide
        return null;
    }

    private AssetType byExtension(String ext) {
        if (MODEL_EXT.contains(ext)) return AssetType.MODEL_3D;
        if (ENV_EXT.contains(ext)) return AssetType.ENVIRONMENT_MAP;
        if (TEXTURE_EXT.contains(ext)) return AssetType.TEXTURE;
        if (VIDEO_EXT.contains(ext)) return AssetType.VIDEO;
        if (AUDIO_EXT.contains(ext)) return AssetType.AUDIO;
        if (IMAGE_EXT.contains(ext)) return AssetType.IMAGE;
        if (SCRIPT_EXT.contains(ext)) return AssetType.JAVASCRIPT;
        if ("css".equals(ext)) return AssetType.STYLESHEET;
        if (HTML_EXT.contains(ext)) return AssetType.HTML;
        if (FONT_EXT.contains(ext)) return AssetType.FONT;
        return AssetType.OTHER;
    }

    private AssetClassification sniff(AssetType type, boolean genericContentType, byte[] sample) {
        if (sample == null || sample.length == 0) return null;
        boolean imageLike = type == AssetType.IMAGE || type == AssetType.OTHER || type == AssetType.TEXTURE;

        if ((genericContentType || type == AssetType.OTHER) && startsWith(sample, GLB_MAGIC)) {
            return AssetClassification.of(AssetType.MODEL_3D, "glb");
        }
        if (type == AssetType.OTHER && looksLikeGltfJson(sample)) {
            return AssetClassification.of(AssetType.MODEL_3D, "gltf");
        }
        if (!imageLike && !genericContentType) return null;

        if (startsWith(sample, KTX2_MAGIC)) return AssetClassification.of(AssetType.TEXTURE, "ktx2");
        if (startsWith(sample, KTX_MAGIC)) return AssetClassification.of(AssetType.TEXTURE, "ktx");
        if (startsWith(sample, DDS_MAGIC)) return AssetClassification.of(AssetType.TEXTURE, "dds");
        if (startsWith(sample, BASIS_MAGIC) && type != AssetType.IMAGE) {
            return AssetClassification.of(AssetType.TEXTURE, "basis");
        }
        if (startsWith(sample, RADIANCE_MAGIC) || startsWith(sample, RGBE_MAGIC)) {
            return AssetClassification.of(AssetType.ENVIRONMENT_MAP, "hdr");
        }
        if (startsWith(sample, EXR_MAGIC)) return AssetClassification.of(AssetType.ENVIRONMENT_MAP, "exr");
        return null;
    }

    private static boolean looksLikeGltfJson(byte[] sample) {
        String head = new String(sample, StandardCharsets.ISO_8859_1).trim();
        return head.startsWith("{") && head.contains("\"asset\"");
    }

    private static boolean looksLikeTexture(String name) {
        return name.contains("texture") || name.contains("normal") || name.contains("diffuse")
                || name.contains("specular") || name.contains("albedo") || name.contains("roughness")
                || name.contains("metallic");
    }

    private static String subtypeFor(String ct, String ext) {
        if (!ext.isEmpty()) return ext;
        if (ct.isEmpty() || MediaTypes.isGeneric(ct)) return null;
        int slash = ct.indexOf('/');
        return slash >= 0 ? ct.substring(slash + 1) : ct;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) return false;
        }
        return true;
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static Set<String> set(String... values) {
        return new HashSet<>(Arrays.asList(values));
    }
}
