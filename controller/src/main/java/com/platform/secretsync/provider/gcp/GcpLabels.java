package com.platform.secretsync.provider.gcp;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * GCP label rules: lower case letters, digits, {@code _} and {@code -}, at most 63 characters.
 */
final class GcpLabels {

    static final int MAX_LENGTH = 63;

    private GcpLabels() {
    }

    static String sanitize(String value) {
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
        return sanitized.length() > MAX_LENGTH ? sanitized.substring(0, MAX_LENGTH) : sanitized;
    }

    static Map<String, String> sanitize(Map<String, String> tags) {
        Map<String, String> labels = new TreeMap<>();
        tags.forEach((key, value) -> labels.put(sanitize(key), sanitize(value)));
        return labels;
    }
}
