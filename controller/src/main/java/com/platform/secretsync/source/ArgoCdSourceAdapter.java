package com.platform.secretsync.source;

import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.SourceException;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls snapshots for ArgoCD {@code Application} objects by cloning the repository they point at.
 * The checksum of such a snapshot is the resolved commit id.
 */
@Slf4j
@Component
public class ArgoCdSourceAdapter implements SourceAdapter {

    public static final String API_VERSION = "argoproj.io/v1alpha1";

    private final SourceObjectReader reader;
    private final GitTreeExporter exporter;
    private final SnapshotCache cache;

    public ArgoCdSourceAdapter(SourceObjectReader reader, GitTreeExporter exporter, SnapshotCache cache) {
        this.reader = reader;
        this.exporter = exporter;
        this.cache = cache;
    }

    @Override
    public String kind() {
        return SourceRef.ARGOCD_APPLICATION;
    }

    @Override
    public Snapshot pull(SyncTargetKey target, SourceRef sourceRef) {
        String namespace = sourceRef.getNamespace() != null ? sourceRef.getNamespace() : target.namespace();
        String ref = sourceRef.describe(target.namespace());

        GenericKubernetesResource application = reader.find(API_VERSION, kind(), namespace, sourceRef.getName())
            .orElseThrow(() -> SourceException.notFound(ref, "Application " + namespace + "/"
                + sourceRef.getName() + " does not exist"));

        GitSource source = GitSource.from(application)
            .orElseThrow(() -> SourceException.notFound(ref, "Application has no spec.source.repoURL"));

        Path mirror = cache.targetDir(target).resolve(".mirror");
        String commitId = exporter.fetch(ref, source.repoUrl(), source.targetRevision(), mirror);

        Optional<Path> existing = cache.findComplete(target, commitId);
        if (existing.isPresent()) {
            return new Snapshot(existing.get(), commitId, commitId, Instant.now());
        }

        Path snapshotDir = cache.snapshotDir(target, commitId);
        try {
            int files = exporter.export(ref, mirror, commitId, snapshotDir);
            cache.markComplete(target, snapshotDir);
            log.info("Exported {} files from {} at {}", files, source.repoUrl(), commitId);
        } catch (RuntimeException e) {
            cache.discard(snapshotDir);
            throw e;
        }
        return new Snapshot(snapshotDir, commitId, commitId, Instant.now());
    }

    /**
     * The {@code spec.source} block of an Application.
     */
    record GitSource(String repoUrl, String targetRevision) {

        static Optional<GitSource> from(GenericKubernetesResource application) {
            Object spec = application.getAdditionalProperties().get("spec");
            if (!(spec instanceof Map<?, ?> specMap) || !(specMap.get("source") instanceof Map<?, ?> source)) {
                return Optional.empty();
            }
            Object repoUrl = source.get("repoURL");
            if (!(repoUrl instanceof String url) || url.isBlank()) {
                return Optional.empty();
            }
            Object revision = source.get("targetRevision");
            return Optional.of(new GitSource(url, revision instanceof String r && !r.isBlank() ? r : "HEAD"));
        }
    }
}
