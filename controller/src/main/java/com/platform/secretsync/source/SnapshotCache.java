package com.platform.secretsync.source;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.SyncTargetKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * On-disk layout of extracted snapshots: {@code {cacheDir}/{namespace}/{name}/{checksum}}.
 * A directory only counts as a snapshot once its completion marker exists.
 */
@Slf4j
@Component
public class SnapshotCache {

    private static final String COMPLETE_MARKER = ".snapshot-complete";

    private final Path cacheDir;
    private final int keepSnapshots;

    public SnapshotCache(SecretSyncProperties properties) {
        this.cacheDir = properties.getSource().getCacheDir();
        this.keepSnapshots = Math.max(1, properties.getSource().getKeepSnapshots());
    }

    public Path targetDir(SyncTargetKey target) {
        return cacheDir.resolve(sanitize(target.namespace())).resolve(sanitize(target.name()));
    }

    public Path snapshotDir(SyncTargetKey target, String checksum) {
        return targetDir(target).resolve(sanitize(checksum));
    }

    public Optional<Path> findComplete(SyncTargetKey target, String checksum) {
        Path dir = snapshotDir(target, checksum);
        return Files.exists(dir.resolve(COMPLETE_MARKER)) ? Optional.of(dir) : Optional.empty();
    }

    /**
     * Marks a populated snapshot directory complete and removes older snapshots beyond the retention count.
     */
    public void markComplete(SyncTargetKey target, Path snapshotDir) {
        try {
            Files.writeString(snapshotDir.resolve(COMPLETE_MARKER), "");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        prune(target, snapshotDir);
    }

    /**
     * Drops a half-written snapshot directory.
     */
    public void discard(Path snapshotDir) {
        try {
            FileSystemUtils.deleteRecursively(snapshotDir);
        } catch (IOException e) {
            log.warn("Failed to remove incomplete snapshot {}: {}", snapshotDir, e.getMessage());
        }
    }

    /**
     * Removes every snapshot of a deleted sync target.
     */
    public void evict(SyncTargetKey target) {
        discard(targetDir(target));
    }

    private void prune(SyncTargetKey target, Path keep) {
        Path dir = targetDir(target);
        try (Stream<Path> children = Files.list(dir)) {
            List<Path> snapshots = children
                .filter(Files::isDirectory)
                .filter(p -> !p.getFileName().toString().startsWith("."))
                .filter(p -> !p.equals(keep))
                .sorted(Comparator.comparing(SnapshotCache::lastModified).reversed())
                .toList();
            for (int i = keepSnapshots - 1; i < snapshots.size(); i++) {
                log.debug("Pruning old snapshot {}", snapshots.get(i));
                discard(snapshots.get(i));
            }
        } catch (IOException e) {
            log.warn("Failed to prune snapshots in {}: {}", dir, e.getMessage());
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    static String sanitize(String component) {
        return component.replaceAll("[^A-Za-z0-9._-]", "-").replace("..", "-");
    }
}
