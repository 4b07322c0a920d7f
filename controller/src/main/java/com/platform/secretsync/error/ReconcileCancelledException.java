package com.platform.secretsync.error;

/**
 * Thrown at a reconcile checkpoint once the sync target has been deleted or the controller is stopping.
 */
public class ReconcileCancelledException extends SecretSyncException {

    public ReconcileCancelledException(String target) {
        super(ErrorCode.RECONCILE_CANCELLED, "Reconcile cancelled for " + target);
    }
}
