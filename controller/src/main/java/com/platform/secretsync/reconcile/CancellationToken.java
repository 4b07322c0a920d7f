package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.ReconcileCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation checked between reconcile steps.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws ReconcileCancelledException once {@link #cancel()} has been called
     */
    public void checkpoint(SyncTargetKey target) {
        if (cancelled.get()) {
            throw new ReconcileCancelledException(target.toString());
        }
    }
}
