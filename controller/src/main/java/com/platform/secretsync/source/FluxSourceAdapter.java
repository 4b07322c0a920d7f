package com.platform.secretsync.source;

import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.SourceException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls snapshots from Flux {@code GitRepository} objects by downloading the artifact they publish.
 */
@Slf4j
@Component
public class FluxSourceAdapter implements SourceAdapter {

    public static final String API_VERSION = "source.toolkit.fluxcd.io/v1";

    private final SourceObjectReader reader;
    private final ArtifactDownloader downloader;
    private final TarballExtractor extractor;
    private final SnapshotCache cache;

    public FluxSourceAdapter(SourceObjectReader reader, ArtifactDownloader downloader,
                             TarballExtractor extractor, SnapshotCache cache) {
        this.reader = reader;
        this.downloader = downloader;
        this.extractor = extractor;
        this.cache = cache;
    }

    @Override
    public String kind() {
        return SourceRef.FLUX_GIT_REPOSITORY;
    }

    @Override
    public Snapshot pull(SyncTargetKey target, SourceRef sourceRef) {
        String namespace = sourceRef.getNamespace() != null ? sourceRef.getNamespace() : target.namespace();
        String ref = sourceRef.describe(target.namespace());

        GenericKubernetesResource repository = reader.find(API_VERSION, kind(), namespace, sourceRef.getName())
            .orElseThrow(() -> SourceException.notFound(ref, "GitRepository " + namespace + "/"
                + sourceRef.getName() + " does not exist"));

        Artifact artifact = Artifact.from(repository)
            .orElseThrow(() -> SourceException.notFound(ref, "GitRepository has not produced an artifact yet"));

        if (artifact.checksum() != null) {
            Optional<Path> existing = cache.findComplete(target, artifact.checksum());
            if (existing.isPresent()) {
                log.debug("Artifact {} for {} already extracted", artifact.checksum(), target);
                return new Snapshot(existing.get(), artifact.checksum(), artifact.revision(), Instant.now());
            }
        }

        Path archive = cache.targetDir(target).resolve("download-" + System.nanoTime() + ".tar.gz");
        Path snapshotDir = null;
        try {
            String checksum = downloader.download(ref, artifact.url(), artifact.checksum(), archive);
            Optional<Path> existing = cache.findComplete(target, checksum);
            if (existing.isPresent()) {
                return new Snapshot(existing.get(), checksum, artifact.revision(), Instant.now());
            }

            snapshotDir = cache.snapshotDir(target, checksum);
            int files = extractor.extract(ref, archive, snapshotDir);
            cache.markComplete(target, snapshotDir);
            log.info("Extracted {} files from {} revision {}", files, ref, artifact.revision());
            return new Snapshot(snapshotDir, checksum, artifact.revision(), Instant.now());
        } catch (RuntimeException e) {
            if (snapshotDir != null) {
                cache.discard(snapshotDir);
            }
            throw e;
        } finally {
            deleteArchive(archive);
        }
    }

    private static void deleteArchive(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete downloaded archive {}: {}", file, e.getMessage());
        }
    }

    /**
     * The {@code status.artifact} block of a GitRepository.
     */
    record Artifact(String url, String revision, String checksum) {

        static Optional<Artifact> from(GenericKubernetesResource repository) {
            Object status = repository.getAdditionalProperties().get("status");
            if (!(status instanceof Map<?, ?> statusMap)) {
                return Optional.empty();
            }
            Object artifact = statusMap.get("artifact");
            if (!(artifact instanceof Map<?, ?> artifactMap)) {
                return Optional.empty();
            }
            if (!(artifactMap.get("url") instanceof String url) || url.isBlank()) {
                return Optional.empty();
            }
            String revision = artifactMap.get("revision") instanceof String value ? value : "unknown";
            return Optional.of(new Artifact(url, revision, checksumOf(artifactMap)));
        }

        private static String checksumOf(Map<?, ?> fields) {
            Object digest = fields.get("digest");
            if (digest instanceof String value && value.startsWith("sha256:")) {
                return value.substring("sha256:".length()).toLowerCase();
            }
            Object checksum = fields.get("checksum");
            if (checksum instanceof String value && !value.isBlank()) {
                return value.toLowerCase();
            }
            return null;
        }
    }
}
