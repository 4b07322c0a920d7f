package com.platform.secretsync.kustomize;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.error.ResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code kustomize build} on a directory of a snapshot and returns the rendered YAML stream.
 */
@Slf4j
@Component
public class KustomizeBuilder {

    private final String binary;
    private final Duration timeout;

    public KustomizeBuilder(SecretSyncProperties properties) {
        this.binary = properties.getKustomize().getBinary();
        this.timeout = properties.getKustomize().getTimeout();
    }

    public String build(Path contentRoot, String kustomizePath) {
        Path root = contentRoot.toAbsolutePath().normalize();
        Path directory = root.resolve(kustomizePath).normalize();
        if (!directory.startsWith(root)) {
            throw ResolutionException.kustomizeFailed(directory, "path leaves the source tree");
        }
        if (!Files.isDirectory(directory)) {
            throw ResolutionException.kustomizeFailed(directory, "directory does not exist");
        }

        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("kustomize-", ".out");
            stderr = Files.createTempFile("kustomize-", ".err");
            log.info("Running {} build {}", binary, kustomizePath);
            Process process = new ProcessBuilder(binary, "build", directory.toString())
                .directory(root.toFile())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile())
                .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw ResolutionException.kustomizeFailed(directory, "timed out after " + timeout);
            }
            if (process.exitValue() != 0) {
                String error = Files.readString(stderr, StandardCharsets.UTF_8).trim();
                throw ResolutionException.kustomizeFailed(directory,
                    "exit code " + process.exitValue() + (error.isEmpty() ? "" : ": " + error));
            }
            return Files.readString(stdout, StandardCharsets.UTF_8);

        } catch (IOException e) {
            throw ResolutionException.kustomizeFailed(directory, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ResolutionException.kustomizeFailed(directory, "interrupted", e);
        } finally {
            deleteTemp(stdout);
            deleteTemp(stderr);
        }
    }

    private static void deleteTemp(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
        }
    }
}
