package com.example.procloner.service;

import com.example.procloner.config.CrawlProperties;
import com.example.procloner.model.AssetType;
import com.example.procloner.model.BuildTool;
import com.example.procloner.model.BuildToolFingerprint;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.CrawlState;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.DownloadStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlExecutionTest {

    private static final String ROOT = "https://site.test/";

    private static final String INDEX = "<!doctype html><html><head>"
            + "<link rel=\"stylesheet\" href=\"/css/main.css\">"
            + "<script src=\"/js/chunk-vendors.js\"></script>"
            + "<script src=\"/js/app.js\"></script>"
            + "</head><body><div id=\"app\">"
            + "<img src=\"/images/logo.png\"><img src=\"/images/missing.png\">"
            + "<a href=\"/about\">About</a>"
            + "</div></body></html>";

    private static final String ABOUT = "<html><body><a href=\"/deep\">deeper</a>"
            + "<img src=\"/images/logo.png\"></body></html>";

    @TempDir
    Path outputRoot;

    private InMemoryResourceFetcher fetcher;
    private CrawlEngine engine;
    private final List<String> pagesSeen = new CopyOnWriteArrayList<>();
    private final List<BuildToolFingerprint> fingerprints = new CopyOnWriteArrayList<>();

    private final CrawlListener listener = new CrawlListener() {
        @Override
        public void onFingerprint(BuildToolFingerprint fingerprint) {
            fingerprints.add(fingerprint);
        }

        @Override
        public void onPageVisited(String url, String localPath, int pagesVisited) {
            pagesSeen.add(url);
        }
    };

    @BeforeEach
    void setUp() {
        fetcher = new InMemoryResourceFetcher()
                .page(ROOT, INDEX)
                .page(ROOT + "about", ABOUT)
                .page(ROOT + "deep", "<html><body>deep</body></html>")
                .text(ROOT + "css/main.css", "text/css", "body { background: url('../images/bg.jpg'); }")
                .text(ROOT + "js/chunk-vendors.js", "application/javascript", "var v = 1;")
                .text(ROOT + "js/app.js", "application/javascript", "load('/models/robot.glb');")
                .respond(ROOT + "images/logo.png", 200, "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'})
                .respond(ROOT + "images/bg.jpg", 200, "image/jpeg", new byte[]{(byte) 0xFF, (byte) 0xD8})
                .respond(ROOT + "models/robot.glb", 200, "model/gltf-binary", "glTF....".getBytes());
        ReferenceExtractor references = new ReferenceExtractor();
        engine = new CrawlEngine(fetcher, new AssetClassifier(), new BuildToolDetector(),
                new PageAnalyzer(references), references, new CrawlProperties());
        engine.init();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private CrawlExecution execution(CrawlState state, CloneOptions options, Instant deadline) {
        return engine.newExecution("s-1", state, outputRoot, options, deadline, listener);
    }

    private CrawlExecution execution(CrawlState state) {
        return execution(state, new CloneOptions(), Instant.now().plusSeconds(60));
    }

    @Test
    @DisplayName("crawls pages within depth and maps assets under the detected convention")
    void crawlsSite() throws Exception {
        CrawlState state = new CrawlState(ROOT, 2);

        CloningResult result = execution(state).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(state.getFingerprint().getTool()).isEqualTo(BuildTool.VUE_CLI);
        assertThat(fingerprints).hasSize(1);
        assertThat(pagesSeen).containsExactlyInAnyOrder(ROOT, ROOT + "about");
        assertThat(state.getPages()).containsEntry(ROOT, "index.html").containsEntry(ROOT + "about", "about.html");
        assertThat(state.getDeferredPages()).containsExactly(ROOT + "deep");
        assertThat(fetcher.requested()).doesNotContain(ROOT + "deep");

        DiscoveredAsset logo = state.getAssets().get(ROOT + "images/logo.png");
        assertThat(logo.getStatus()).isEqualTo(DownloadStatus.DOWNLOADED);
        assertThat(logo.getLocalPath()).isEqualTo("img/logo.png");
        assertThat(Files.exists(outputRoot.resolve("img/logo.png"))).isTrue();
        assertThat(state.getAssets().get(ROOT + "js/app.js").getLocalPath()).isEqualTo("js/app.js");
        assertThat(state.getAssets().get(ROOT + "css/main.css").getLocalPath()).isEqualTo("css/main.css");
        assertThat(Files.exists(outputRoot.resolve("index.html"))).isTrue();
    }

    @Test
    @DisplayName("follows references found inside stylesheets and scripts")
    void recursiveDiscovery() throws Exception {
        CrawlState state = new CrawlState(ROOT, 1);

        execution(state).run();

        DiscoveredAsset bg = state.getAssets().get(ROOT + "images/bg.jpg");
        assertThat(bg).isNotNull();
        assertThat(bg.getReferrer()).isEqualTo(ROOT + "css/main.css");
        assertThat(bg.isDownloaded()).isTrue();
        DiscoveredAsset model = state.getAssets().get(ROOT + "models/robot.glb");
        assertThat(model.getType()).isEqualTo(AssetType.MODEL_3D);
        assertThat(model.getLocalPath()).isEqualTo("assets/3d-model/robot.glb");
    }

    @Test
    @DisplayName("per-asset failures are recorded and do not abort the crawl")
    void assetFailureRecorded() throws Exception {
        CrawlState state = new CrawlState(ROOT, 1);

        CloningResult result = execution(state).run();

        DiscoveredAsset missing = state.getAssets().get(ROOT + "images/missing.png");
        assertThat(missing.getStatus()).isEqualTo(DownloadStatus.FAILED);
        assertThat(missing.getFailureReason()).contains("404");
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAssetsFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("an unexpected runtime error while fetching an asset settles it as failed")
    void runtimeAssetErrorRecorded() throws Exception {
        fetcher.broken(ROOT + "images/logo.png", new IllegalArgumentException("Malformed URL: exa mple"));
        final List<DiscoveredAsset> settled = new CopyOnWriteArrayList<>();
        CrawlListener recording = new CrawlListener() {
            @Override
            public void onAssetSettled(DiscoveredAsset asset) {
                settled.add(asset);
            }
        };
        CrawlState state = new CrawlState(ROOT, 1);

        CloningResult result = engine.newExecution("s-1", state, outputRoot, new CloneOptions(),
                Instant.now().plusSeconds(60), recording).run();

        DiscoveredAsset logo = state.getAssets().get(ROOT + "images/logo.png");
        assertThat(logo.getStatus()).isEqualTo(DownloadStatus.FAILED);
        assertThat(logo.getFailureReason()).contains("Malformed URL");
        assertThat(settled).contains(logo);
        assertThat(state.countAssets(DownloadStatus.PENDING)).isZero();
        assertThat(result.getAssetsFailed()).isEqualTo(2);
    }

    @Test
    @DisplayName("an unexpected runtime error on a linked page drops that page only")
    void runtimePageErrorRecorded() throws Exception {
        fetcher.broken(ROOT + "about", new IllegalStateException("connection reset by parser"));
        CrawlState state = new CrawlState(ROOT, 2);

        CloningResult result = execution(state).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(state.getPages()).containsKey(ROOT).doesNotContainKey(ROOT + "about");
        assertThat(state.getPendingPages()).isEmpty();
        assertThat(state.getAssets().get(ROOT + "images/logo.png").isDownloaded()).isTrue();
    }

    @Test
    @DisplayName("downloaded assets have unique paths that exist under the output root")
    void downloadedPathsUnique() throws Exception {
        CrawlState state = new CrawlState(ROOT, 2);
        execution(state).run();

        Set<String> paths = new HashSet<>();
        for (DiscoveredAsset a : state.getAssets().values()) {
            if (!a.isDownloaded()) continue;
            assertThat(paths.add(a.getLocalPath())).isTrue();
            assertThat(Files.isRegularFile(outputRoot.resolve(a.getLocalPath()))).isTrue();
        }
        assertThat(paths).isNotEmpty();
    }

    @Test
    @DisplayName("asset types that were not requested are skipped")
    void includeFilter() throws Exception {
        CloneOptions options = new CloneOptions();
        options.setIncludeAssets(EnumSet.of(AssetType.IMAGE));
        CrawlState state = new CrawlState(ROOT, 1);

        execution(state, options, Instant.now().plusSeconds(60)).run();

        assertThat(state.getAssets()).doesNotContainKey(ROOT + "js/app.js");
        assertThat(state.getAssets()).containsKey(ROOT + "images/logo.png");
    }

    @Test
    @DisplayName("an unreachable root page is fatal")
    void rootFailure() {
        fetcher.respond(ROOT, 500, "text/html", new byte[0]);
        CrawlState state = new CrawlState(ROOT, 2);

        assertThatThrownBy(() -> execution(state).run())
                .isInstanceOf(PageFetchException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("a passed deadline stops the crawl as timed out")
    void deadline() throws Exception {
        CrawlState state = new CrawlState(ROOT, 2);
        CrawlExecution exec = execution(state, new CloneOptions(), Instant.now().minusSeconds(1));

        CloningResult result = exec.run();

        assertThat(exec.getStopReason()).isEqualTo(CrawlExecution.StopReason.TIMED_OUT);
        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    @DisplayName("pausing abandons in-flight downloads and a later run picks them up again")
    void pauseAndResume() throws Exception {
        fetcher.slow(ROOT + "images/logo.png");
        final CrawlState state = new CrawlState(ROOT, 1);
        final CrawlExecution first = execution(state);
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<CloningResult> running = runner.submit(first::run);
            assertThat(fetcher.slowStarted.await(5, TimeUnit.SECONDS)).isTrue();

            first.stop(CrawlExecution.StopReason.PAUSED);
            CloningResult paused = running.get(10, TimeUnit.SECONDS);

            assertThat(paused.isSuccess()).isFalse();
            assertThat(first.getStopReason()).isEqualTo(CrawlExecution.StopReason.PAUSED);
            assertThat(state.getAssets().get(ROOT + "images/logo.png").getStatus())
                    .isEqualTo(DownloadStatus.ABANDONED);
        } finally {
            fetcher.release();
            runner.shutdownNow();
        }

        fetcher.resetGate();
        CloningResult resumed = execution(state).run();

        assertThat(resumed.isSuccess()).isTrue();
        DiscoveredAsset logo = state.getAssets().get(ROOT + "images/logo.png");
        assertThat(logo.getStatus()).isEqualTo(DownloadStatus.DOWNLOADED);
        assertThat(logo.getLocalPath()).isEqualTo("img/logo.png");
        assertThat(Collections.frequency(fetcher.requested(), ROOT)).isEqualTo(1);
    }

    @Test
    void stopIsFirstReasonWins() {
        CrawlExecution exec = execution(new CrawlState(ROOT, 1));
        exec.stop(CrawlExecution.StopReason.CANCELLED);
        exec.stop(CrawlExecution.StopReason.PAUSED);

        assertThat(exec.getStopReason()).isEqualTo(CrawlExecution.StopReason.CANCELLED);
        assertThat(exec.isStopped()).isTrue();
    }

    @Test
    void likelyHtmlByExtension() {
        assertThat(CrawlExecution.isLikelyHtml("https://site.test/about")).isTrue();
        assertThat(CrawlExecution.isLikelyHtml("https://site.test/page.php")).isTrue();
        assertThat(CrawlExecution.isLikelyHtml("https://site.test/file.pdf")).isFalse();
    }
}
