package com.platform.secretsync.source;

import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;

/**
 * Fetches a snapshot from a GitOps source object.
 */
public interface SourceAdapter {

    /**
     * Source object kind this adapter understands, e.g. {@code GitRepository}.
     */
    String kind();

    /**
     * Pulls the current content of the referenced source.
     *
     * @throws com.platform.secretsync.error.SourceException with SOURCE_NOT_FOUND, CHECKSUM_MISMATCH
     *         or SOURCE_TIMEOUT
     */
    Snapshot pull(SyncTargetKey target, SourceRef sourceRef);
}
