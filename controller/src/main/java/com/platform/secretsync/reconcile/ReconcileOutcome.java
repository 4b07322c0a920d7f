package com.platform.secretsync.reconcile;

/**
 * Result of one reconcile run, used by the scheduler to pick the next run time.
 *
 * @param pulled whether the source was pulled during the run
 * @param writes provider writes performed
 */
public record ReconcileOutcome(Result result, boolean pulled, int writes, String message) {

    public enum Result {
        SYNCED,
        /** Transient failure, retried with backoff. */
        RETRY,
        /** Fatal failure, retried with backoff. */
        FAILED,
        /** Spec is invalid, nothing happens until it changes. */
        CONFIG_ERROR,
        CANCELLED,
        SUSPENDED
    }

    public static ReconcileOutcome synced(boolean pulled, int writes, String message) {
        return new ReconcileOutcome(Result.SYNCED, pulled, writes, message);
    }

    public static ReconcileOutcome of(Result result, boolean pulled, String message) {
        return new ReconcileOutcome(result, pulled, 0, message);
    }

    public boolean needsBackoff() {
        return result == Result.RETRY || result == Result.FAILED;
    }

    public boolean schedulesNextRun() {
        return result == Result.SYNCED || needsBackoff();
    }
}
