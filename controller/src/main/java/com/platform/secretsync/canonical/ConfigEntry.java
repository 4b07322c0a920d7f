package com.platform.secretsync.canonical;

import java.util.Map;

/**
 * A non-secret configuration value routed to a parameter or config store.
 *
 * @param label       App Configuration label, null elsewhere
 * @param contentType optional content type hint
 */
public record ConfigEntry(String name, String value, String label, String contentType, String sourcePath,
                          Map<String, String> tags) {

    public ConfigEntry {
        tags = Map.copyOf(tags);
    }
}
