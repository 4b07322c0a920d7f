package com.platform.secretsync.diff;

import java.time.Instant;

/**
 * Record of one detected divergence. Values are masked.
 */
public record DriftRecord(
    String target,
    String name,
    DriftType driftType,
    String desired,
    String actual,
    Instant detectedAt,
    String action,
    boolean resolved
) {

    public static DriftRecord create(String target, String name, DriftType driftType, String desired,
                                     String actual, String action) {
        return new DriftRecord(target, name, driftType, desired, actual, Instant.now(), action, false);
    }

    public DriftRecord markResolved() {
        return new DriftRecord(target, name, driftType, desired, actual, detectedAt, action, true);
    }
}
