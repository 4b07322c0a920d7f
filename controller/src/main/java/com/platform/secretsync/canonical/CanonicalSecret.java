package com.platform.secretsync.canonical;

import java.util.Map;

/**
 * A desired provider secret built from Git content.
 *
 * @param name        provider-legal, deterministic name
 * @param enabled     false for entries commented out in Git
 * @param sourceKey   key as written in the source file
 * @param sourcePath  file the value came from, relative to the snapshot root
 * @param location    replica location; null for automatically replicated providers
 */
public record CanonicalSecret(String name, String value, boolean enabled, String sourceKey, String sourcePath,
                              String environment, String location, Map<String, String> tags) {

    public CanonicalSecret {
        tags = Map.copyOf(tags);
    }

    @Override
    public String toString() {
        return "CanonicalSecret[" + name + ", enabled=" + enabled + ", source=" + sourcePath + "]";
    }
}
