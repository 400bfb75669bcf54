package com.example.procloner.service;

import com.example.procloner.model.AssetType;
import com.example.procloner.model.BuildTool;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-toolchain output layout, as a static table keyed by tool and asset type.
 * <p>
 * Types a tool does not list use its fallback template; {@code {type}} in a template is
 * replaced by the asset type's bucket name. A preserved prefix keeps source paths that already
 * follow the tool's layout (for example {@code /static/...} on a create-react-app site).
 */
public final class PathConventions {

    public static final class Convention {
        private final Map<AssetType, String> directories;
        private final String fallback;
        private final String preservedPrefix;

        Convention(Map<AssetType, String> directories, String fallback, String preservedPrefix) {
            this.directories = Collections.unmodifiableMap(directories);
            this.fallback = fallback;
            this.preservedPrefix = preservedPrefix;
        }

        public String directoryFor(AssetType type) {
            String dir = directories.get(type);
            if (dir == null) dir = fallback;
            return dir.replace("{type}", type.value());
        }

        public String getPreservedPrefix() {
            return preservedPrefix;
        }

        public boolean isListed(AssetType type) {
            return directories.containsKey(type);
        }
    }

    private static final Map<BuildTool, Convention> TABLE = new EnumMap<>(BuildTool.class);

    static {
        Map<AssetType, String> vue = new EnumMap<>(AssetType.class);
        vue.put(AssetType.IMAGE, "img/");
        vue.put(AssetType.STYLESHEET, "css/");
        vue.put(AssetType.JAVASCRIPT, "js/");
        vue.put(AssetType.FONT, "fonts/");
        vue.put(AssetType.VIDEO, "media/");
        vue.put(AssetType.AUDIO, "media/");
        TABLE.put(BuildTool.VUE_CLI, new Convention(vue, "assets/{type}/", null));

        Map<AssetType, String> cra = new EnumMap<>(AssetType.class);
        cra.put(AssetType.JAVASCRIPT, "static/js/");
        cra.put(AssetType.STYLESHEET, "static/css/");
        cra.put(AssetType.IMAGE, "static/media/");
        cra.put(AssetType.FONT, "static/media/");
        cra.put(AssetType.VIDEO, "static/media/");
        cra.put(AssetType.AUDIO, "static/media/");
        TABLE.put(BuildTool.CREATE_REACT_APP, new Convention(cra, "static/{type}/", "static/"));

        Map<AssetType, String> vite = new EnumMap<>(AssetType.class);
        vite.put(AssetType.IMAGE, "img/");
        vite.put(AssetType.STYLESHEET, "css/");
        vite.put(AssetType.JAVASCRIPT, "js/");
        vite.put(AssetType.FONT, "fonts/");
        TABLE.put(BuildTool.VITE, new Convention(vite, "assets/", null));

        Map<AssetType, String> webpack = new EnumMap<>(AssetType.class);
        webpack.put(AssetType.IMAGE, "images/");
        webpack.put(AssetType.STYLESHEET, "css/");
        webpack.put(AssetType.JAVASCRIPT, "js/");
        webpack.put(AssetType.FONT, "fonts/");
        TABLE.put(BuildTool.WEBPACK, new Convention(webpack, "dist/{type}/", null));

        TABLE.put(BuildTool.ANGULAR_CLI, new Convention(new EnumMap<AssetType, String>(AssetType.class), "assets/", "assets/"));

        TABLE.put(BuildTool.UNKNOWN, new Convention(new EnumMap<AssetType, String>(AssetType.class), "assets/{type}/", null));
    }

    private PathConventions() {
    }

    public static Convention forTool(BuildTool tool) {
        Convention c = TABLE.get(tool == null ? BuildTool.UNKNOWN : tool);
        return c != null ? c : TABLE.get(BuildTool.UNKNOWN);
    }
}
