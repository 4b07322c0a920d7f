package com.platform.secretsync.state;

import com.platform.secretsync.crd.SyncTargetKey;

import java.time.Instant;

/**
 * Immutable snapshot of one sync target's reconcile state.
 *
 * @param description       short human readable text for {@code status.description}
 * @param failedStep        phase that failed last, null after a successful cycle
 * @param firstFailureTime  start of the current run of failures, null when healthy
 */
public record SyncTargetContext(
    SyncTargetKey target,
    SyncPhase phase,
    SyncPhase previousPhase,
    Instant lastTransitionTime,
    String description,
    SyncPhase failedStep,
    int consecutiveFailures,
    Instant firstFailureTime,
    Instant lastSyncTime,
    String lastRevision,
    String lastChecksum,
    int syncedCount,
    boolean degraded
) {

    public static SyncTargetContext initial(SyncTargetKey target) {
        return new SyncTargetContext(target, SyncPhase.PENDING, null, Instant.now(), "Waiting for first reconcile",
            null, 0, null, null, null, null, 0, false);
    }

    public SyncTargetContext withPhase(SyncPhase newPhase, String newDescription) {
        return new SyncTargetContext(target, newPhase, phase, Instant.now(), newDescription, failedStep,
            consecutiveFailures, firstFailureTime, lastSyncTime, lastRevision, lastChecksum, syncedCount, degraded);
    }

    /**
     * Records a failure of the current step. The failure run starts at the first failure after a success.
     */
    public SyncTargetContext withFailure(SyncPhase newPhase, String reason, boolean nowDegraded) {
        Instant now = Instant.now();
        return new SyncTargetContext(target, newPhase, phase, now, reason, phase, consecutiveFailures + 1,
            firstFailureTime == null ? now : firstFailureTime, lastSyncTime, lastRevision, lastChecksum,
            syncedCount, nowDegraded);
    }

    public SyncTargetContext withSuccess(String newDescription, String revision, String checksum, int synced) {
        Instant now = Instant.now();
        return new SyncTargetContext(target, SyncPhase.SYNCED, phase, now, newDescription, null, 0, null, now,
            revision, checksum, synced, false);
    }

    /**
     * Back to {@code Pending} with the failure history cleared, used when the spec changes.
     */
    public SyncTargetContext reset(String reason) {
        return new SyncTargetContext(target, SyncPhase.PENDING, phase, Instant.now(), reason, null, 0, null,
            lastSyncTime, lastRevision, lastChecksum, syncedCount, false);
    }

    public String summary() {
        return String.format("%s: %s (failures: %d)", target, phase, consecutiveFailures);
    }
}
