package com.platform.secretsync.diff;

/**
 * Kinds of divergence between Git and a provider.
 */
public enum DriftType {
    MISSING,             // Present in Git, absent or soft deleted in the provider
    VALUE_CHANGED,       // Latest enabled payload differs from Git
    DISABLED_IN_PROVIDER, // Enabled in Git, no enabled version in the provider
    SHOULD_BE_DISABLED,  // Commented out in Git, still served by the provider
    NOT_IN_GIT,          // Managed by this target but no longer in Git (prune)
    CONFIG_MISSING,
    CONFIG_CHANGED
}
