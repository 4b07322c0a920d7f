package com.platform.secretsync.kustomize;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ResolutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class KustomizeBuilderTest {

    @TempDir
    Path workDir;

    private Path contentRoot;

    @BeforeEach
    void setUp() throws IOException {
        contentRoot = Files.createDirectories(workDir.resolve("snapshot"));
        Files.createDirectories(contentRoot.resolve("deploy/prod"));
    }

    @Test
    void returnsRenderedOutput() throws IOException {
        KustomizeBuilder builder = builder(script("echo \"kind: Secret\"\necho \"# $1 $2\""), Duration.ofSeconds(10));

        String output = builder.build(contentRoot, "deploy/prod");

        assertThat(output).startsWith("kind: Secret")
            .contains("build " + contentRoot.resolve("deploy/prod").toAbsolutePath().normalize());
    }

    @Test
    void nonZeroExitCarriesStderr() throws IOException {
        KustomizeBuilder builder = builder(script("echo 'accumulating resources: missing' >&2\nexit 3"),
            Duration.ofSeconds(10));

        assertThatThrownBy(() -> builder.build(contentRoot, "deploy/prod"))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("exit code 3")
            .hasMessageContaining("accumulating resources: missing")
            .extracting(e -> ((ResolutionException) e).getErrorCode())
            .isEqualTo(ErrorCode.KUSTOMIZE_BUILD_FAILED);
    }

    @Test
    void slowBuildTimesOut() throws IOException {
        KustomizeBuilder builder = builder(script("sleep 10"), Duration.ofMillis(200));

        assertThatThrownBy(() -> builder.build(contentRoot, "deploy/prod"))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("timed out");
    }

    @Test
    void pathOutsideSnapshotIsRejected() throws IOException {
        KustomizeBuilder builder = builder(script("exit 0"), Duration.ofSeconds(10));

        assertThatThrownBy(() -> builder.build(contentRoot, "../../etc"))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("leaves the source tree");
    }

    @Test
    void missingDirectoryIsRejected() throws IOException {
        KustomizeBuilder builder = builder(script("exit 0"), Duration.ofSeconds(10));

        assertThatThrownBy(() -> builder.build(contentRoot, "deploy/staging"))
            .isInstanceOf(ResolutionException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void missingBinaryIsReported() {
        KustomizeBuilder builder = builder(workDir.resolve("no-such-kustomize").toString(), Duration.ofSeconds(10));

        assertThatThrownBy(() -> builder.build(contentRoot, "deploy/prod"))
            .isInstanceOf(ResolutionException.class)
            .extracting(e -> ((ResolutionException) e).getErrorCode())
            .isEqualTo(ErrorCode.KUSTOMIZE_BUILD_FAILED);
    }

    private String script(String body) throws IOException {
        Path script = workDir.resolve("kustomize-" + System.nanoTime());
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }

    private static KustomizeBuilder builder(String binary, Duration timeout) {
        SecretSyncProperties properties = new SecretSyncProperties();
        properties.getKustomize().setBinary(binary);
        properties.getKustomize().setTimeout(timeout);
        return new KustomizeBuilder(properties);
    }
}
