package com.platform.secretsync.provider;

import java.time.Instant;

/**
 * Deletion scheduled by the provider but not yet carried out.
 */
public record SoftDeleteRecord(Instant deletedAt, Instant scheduledPurgeAt) {
}
