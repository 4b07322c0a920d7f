package com.platform.secretsync.source;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.error.SourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads artifact tarballs over HTTP and verifies their SHA-256 digest.
 */
@Slf4j
@Component
public class ArtifactDownloader {

    private final SecretSyncProperties.Source config;
    private final HttpClient httpClient;

    public ArtifactDownloader(SecretSyncProperties properties) {
        this.config = properties.getSource();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    /**
     * Downloads {@code url} to {@code destination}. The read timeout bounds the whole transfer,
     * body included.
     *
     * @param expectedSha256 lower-case hex digest, or null to skip verification
     * @return the computed lower-case hex digest
     */
    public String download(String sourceRef, String url, String expectedSha256, Path destination) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(config.getReadTimeout())
            .GET()
            .build();

        log.debug("Downloading artifact for {} from {}", sourceRef, url);
        CompletableFuture<HttpResponse<Path>> pending = null;
        try {
            Files.createDirectories(destination.getParent());
            pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofFile(destination));
            HttpResponse<Path> response = pending.get(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (response.statusCode() != 200) {
                Files.deleteIfExists(destination);
                if (response.statusCode() == 404) {
                    throw SourceException.notFound(sourceRef, "Artifact not yet available at " + url);
                }
                throw SourceException.fetchFailed(sourceRef,
                    String.format("Artifact download returned HTTP %d", response.statusCode()), null);
            }

            String actual = sha256(destination);
            if (expectedSha256 != null && !expectedSha256.equalsIgnoreCase(actual)) {
                Files.deleteIfExists(destination);
                throw SourceException.checksumMismatch(sourceRef, expectedSha256, actual);
            }
            return actual;

        } catch (TimeoutException e) {
            pending.cancel(true);
            deleteQuietly(destination);
            throw SourceException.timeout(sourceRef, e);
        } catch (ExecutionException e) {
            deleteQuietly(destination);
            if (e.getCause() instanceof HttpTimeoutException) {
                throw SourceException.timeout(sourceRef, e.getCause());
            }
            throw SourceException.fetchFailed(sourceRef, "Artifact download failed: " + e.getCause().getMessage(),
                e.getCause());
        } catch (IOException e) {
            throw SourceException.fetchFailed(sourceRef, "Artifact download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (pending != null) {
                pending.cancel(true);
            }
            throw SourceException.fetchFailed(sourceRef, "Artifact download interrupted", e);
        }
    }

    private static String sha256(Path file) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove partial download {}: {}", file, e.getMessage());
        }
    }
}
