package com.platform.secretsync.state;

/**
 * Phases a sync target moves through on each reconcile.
 */
public enum SyncPhase {
    PENDING("Pending"),
    PULLING("Pulling"),
    PARSING("Parsing"),
    DECRYPTING("Decrypting"),
    BUILDING_CANONICAL("BuildingCanonical"),
    DIFFING("Diffing"),
    APPLYING("Applying"),
    SYNCED("Synced"),
    ERROR("Error");

    private final String displayName;

    SyncPhase(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Name written to {@code status.phase}.
     */
    public String displayName() {
        return displayName;
    }

    public boolean isIdle() {
        return this == PENDING || this == SYNCED || this == ERROR;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
