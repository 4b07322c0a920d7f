package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SecretManagerConfig;

/**
 * One reconcile run.
 *
 * @param pullDue whether the source must be pulled, otherwise the last snapshot is reused when present
 */
public record ReconcileRequest(SecretManagerConfig resource, boolean pullDue, CancellationToken token) {
}
