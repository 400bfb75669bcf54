package com.example.procloner.service;

import com.example.procloner.model.AssetType;
import com.example.procloner.model.BuildTool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class PathMapperTest {

    private static PathMapper mapper(BuildTool tool) {
        return new PathMapper(tool, new LinkedHashMap<String, String>());
    }

    @Nested
    @DisplayName("conventions")
    class Conventions {

        @Test
        void vueCliImagesGoToImg() {
            assertThat(mapper(BuildTool.VUE_CLI).targetPath("https://example.com/images/logo.png", AssetType.IMAGE))
                    .isEqualTo("img/logo.png");
        }

        @Test
        void createReactAppImagesGoToStaticMedia() {
            assertThat(mapper(BuildTool.CREATE_REACT_APP).targetPath("https://example.com/images/logo.png", AssetType.IMAGE))
                    .isEqualTo("static/media/logo.png");
        }

        @Test
        void createReactAppKeepsExistingStaticLayout() {
            assertThat(mapper(BuildTool.CREATE_REACT_APP)
                    .targetPath("https://example.com/static/js/main.4f2a.chunk.js", AssetType.JAVASCRIPT))
                    .isEqualTo("static/js/main.4f2a.chunk.js");
        }

        @Test
        void unknownToolUsesTypeBucket() {
            assertThat(mapper(BuildTool.UNKNOWN).targetPath("https://example.com/images/logo.png", AssetType.IMAGE))
                    .isEqualTo("assets/image/logo.png");
        }

        @Test
        void unlistedTypeUsesToolFallback() {
            assertThat(mapper(BuildTool.VUE_CLI).targetPath("https://example.com/m/robot.glb", AssetType.MODEL_3D))
                    .isEqualTo("assets/3d-model/robot.glb");
        }

        @Test
        void nullToolBehavesAsUnknown() {
            assertThat(mapper(null).getTool()).isEqualTo(BuildTool.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("file names")
    class FileNames {

        @Test
        @DisplayName("extension-less names take one from the content type")
        void extensionFromContentType() {
            assertThat(PathMapper.fileName("https://cdn.test/img/hero", AssetType.IMAGE, "image/webp"))
                    .isEqualTo("hero.webp");
        }

        @Test
        @DisplayName("directory URLs get a synthesized name")
        void synthesizedName() {
            String name = PathMapper.fileName("https://cdn.test/assets/", AssetType.FONT, null);
            assertThat(name).startsWith("asset-");
        }

        @Test
        void pagePaths() {
            assertThat(PathMapper.pagePath("https://example.com/")).isEqualTo("index.html");
            assertThat(PathMapper.pagePath("https://example.com/docs/intro")).isEqualTo("docs/intro.html");
            assertThat(PathMapper.pagePath("https://example.com/docs/")).isEqualTo("docs/index.html");
            assertThat(PathMapper.pagePath("https://example.com/list?page=2")).isEqualTo("list_q_page-2.html");
        }

        @Test
        void relativize() {
            assertThat(PathMapper.relativize("index.html", "img/logo.png")).isEqualTo("img/logo.png");
            assertThat(PathMapper.relativize("docs/intro.html", "img/logo.png")).isEqualTo("../img/logo.png");
            assertThat(PathMapper.relativize("css/app.css", "fonts/a.woff2")).isEqualTo("../fonts/a.woff2");
        }
    }

    @Nested
    @DisplayName("assignment table")
    class Assignment {

        @Test
        @DisplayName("the first path assigned to a URL is kept")
        void idempotent() {
            PathMapper m = mapper(BuildTool.VUE_CLI);
            String first = m.assign("https://example.com/a/logo.png", AssetType.IMAGE, "image/png");
            String again = m.assign("https://example.com/a/logo.png", AssetType.OTHER, null);

            assertThat(again).isEqualTo(first);
            assertThat(m.lookup("https://example.com/a/logo.png")).isEqualTo("img/logo.png");
            assertThat(m.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("colliding names get a numeric suffix")
        void collisionSuffix() {
            PathMapper m = mapper(BuildTool.VUE_CLI);
            String a = m.assign("https://example.com/a/logo.png", AssetType.IMAGE, null);
            String b = m.assign("https://example.com/b/logo.png", AssetType.IMAGE, null);
            String c = m.assign("https://cdn.test/logo.png", AssetType.IMAGE, null);

            assertThat(a).isEqualTo("img/logo.png");
            assertThat(b).isEqualTo("img/logo_1.png");
            assertThat(c).isEqualTo("img/logo_2.png");
        }

        @Test
        @DisplayName("a restored table keeps its paths taken")
        void restoredTable() {
            Map<String, String> table = new LinkedHashMap<>();
            table.put("https://example.com/a/logo.png", "img/logo.png");
            PathMapper m = new PathMapper(BuildTool.VUE_CLI, table);

            assertThat(m.assign("https://example.com/b/logo.png", AssetType.IMAGE, null)).isEqualTo("img/logo_1.png");
        }

        @Test
        @DisplayName("localPath returns the assigned path, or assigns one from the extension")
        void localPath() {
            PathMapper m = mapper(BuildTool.VUE_CLI);
            String assigned = m.assign("https://example.com/a/logo.png", AssetType.IMAGE, "image/png");
            String expected = m.targetPath("https://example.com/js/app.js", AssetType.JAVASCRIPT);

            assertThat(m.localPath("https://example.com/a/logo.png")).isEqualTo(assigned);
            assertThat(m.localPath("https://example.com/js/app.js")).isEqualTo(expected).isEqualTo("js/app.js");
            assertThat(m.lookup("https://example.com/js/app.js")).isEqualTo("js/app.js");
            assertThat(m.localPath("https://example.com/b/logo.png")).isEqualTo("img/logo_1.png");
            assertThat(m.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("derived files claim their own path without displacing an asset")
        void variantPath() {
            PathMapper m = mapper(BuildTool.VUE_CLI);
            m.assign("https://example.com/hero.png", AssetType.IMAGE, null);
            m.assign("https://example.com/hero_optimized.png", AssetType.IMAGE, null);

            String variant = m.assignVariant("https://example.com/hero.png", "optimized", "img/hero_optimized.png");

            assertThat(variant).isEqualTo("img/hero_optimized_1.png");
            assertThat(m.assignVariant("https://example.com/hero.png", "optimized", "img/hero_optimized.png"))
                    .isEqualTo(variant);
            assertThat(m.lookup("https://example.com/hero_optimized.png")).isEqualTo("img/hero_optimized.png");
        }

        @Test
        @DisplayName("concurrent assignment keeps URL to path one-to-one")
        void concurrentBijection() throws Exception {
            final PathMapper m = mapper(BuildTool.UNKNOWN);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    final String url = "https://host" + (i % 20) + ".test/dir" + i + "/texture.png";
                    futures.add(pool.submit(new Callable<String>() {
                        public String call() {
                            return m.assign(url, AssetType.IMAGE, "image/png");
                        }
                    }));
                }
                Set<String> paths = new HashSet<>();
                for (Future<String> f : futures) {
                    paths.add(f.get());
                }
                assertThat(paths).hasSize(200);
                assertThat(m.size()).isEqualTo(200);
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
