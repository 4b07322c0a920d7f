package com.platform.secretsync.canonical;

import java.util.List;

/**
 * Desired state of one sync target.
 */
public record CanonicalSet(List<CanonicalSecret> secrets, List<ConfigEntry> configs) {

    public CanonicalSet {
        secrets = List.copyOf(secrets);
        configs = List.copyOf(configs);
    }

    public static CanonicalSet empty() {
        return new CanonicalSet(List.of(), List.of());
    }
}
