package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetStatus;

/**
 * Persists the status subresource of a sync target.
 */
public interface StatusWriter {

    void write(SyncTargetKey target, SyncTargetStatus status);
}
