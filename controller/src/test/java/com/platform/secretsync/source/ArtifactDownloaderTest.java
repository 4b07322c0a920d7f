package com.platform.secretsync.source;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.SourceException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactDownloaderTest {

    private static final byte[] BODY = "artifact-bytes".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path dir;

    private final CountDownLatch release = new CountDownLatch(1);
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private HttpServer server;
    private ArtifactDownloader downloader;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.setExecutor(executor);
        server.createContext("/ok.tar.gz", exchange -> {
            exchange.sendResponseHeaders(200, BODY.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(BODY);
            }
        });
        server.createContext("/stalled.tar.gz", exchange -> {
            exchange.sendResponseHeaders(200, 1024);
            OutputStream out = exchange.getResponseBody();
            out.write(BODY);
            out.flush();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.start();

        SecretSyncProperties properties = SourceTestSupport.properties(dir);
        properties.getSource().setReadTimeout(Duration.ofMillis(500));
        downloader = new ArtifactDownloader(properties);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    void downloadsAndReturnsDigest() throws IOException {
        Path archive = dir.resolve("in/ok.tar.gz");

        String digest = downloader.download("flux/ok", url("/ok.tar.gz"), null, archive);

        assertThat(digest).hasSize(64);
        assertThat(Files.readAllBytes(archive)).isEqualTo(BODY);
    }

    @Test
    void stalledBodyTimesOutAndLeavesNoFile() {
        Path archive = dir.resolve("in/stalled.tar.gz");
        long started = System.nanoTime();

        assertThatThrownBy(() -> downloader.download("flux/stalled", url("/stalled.tar.gz"), null, archive))
            .isInstanceOf(SourceException.class)
            .extracting(e -> ((SourceException) e).getErrorCode())
            .isEqualTo(ErrorCode.SOURCE_TIMEOUT);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
        assertThat(archive).doesNotExist();
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }
}
