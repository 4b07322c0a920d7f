package com.platform.secretsync.source;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Immutable, checksummed view of a Git tree extracted to local disk for one sync target.
 */
public record Snapshot(Path contentRoot, String checksum, String revision, Instant pulledAt) {

    public boolean sameContentAs(Snapshot other) {
        return other != null && checksum.equals(other.checksum);
    }
}
