package com.platform.secretsync.canonical;

import com.platform.secretsync.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives environment and location metadata from provider tags, falling back through
 * alternate tag keys, path-derived values and finally {@code unknown}.
 */
@Component
public class MetadataNormalizer {

    public static final String UNKNOWN = "unknown";
    public static final String AUTOMATIC = "automatic";

    static final List<String> ENVIRONMENT_KEYS =
        List.of("environment", "Environment", "env", "Env", "ENVIRONMENT", "ENV");
    static final List<String> LOCATION_KEYS =
        List.of("location", "Location", "region", "Region", "LOCATION", "REGION");

    private static final Pattern ARN = Pattern.compile("^arn:[^:]+:[^:]+:([^:]*):.*");
    private static final Pattern LOCATIONS_SEGMENT = Pattern.compile("/locations/([^/]+)(/|$)");

    /**
     * @param pathProfile profile directory the value was read from, may be null
     */
    public String environment(Map<String, String> tags, String pathProfile) {
        String value = firstTag(tags, ENVIRONMENT_KEYS);
        if (value == null && pathProfile != null && !pathProfile.isBlank()) {
            value = pathProfile.trim();
        }
        return requireNonEmpty("environment", value == null ? UNKNOWN : value);
    }

    /**
     * Location from tags, else from the resource identifier (first match wins: ARN region, then a
     * {@code /locations/<loc>/} segment).
     *
     * @param identifier           provider resource identifier, may be null
     * @param automaticReplication whether the provider replicates without a fixed location
     * @return the location, or null only when replication is automatic and nothing pins a location
     */
    public String location(Map<String, String> tags, String identifier, boolean automaticReplication) {
        String value = firstTag(tags, LOCATION_KEYS);
        if (value != null && AUTOMATIC.equalsIgnoreCase(value)) {
            value = null;
        }
        if (value == null && identifier != null) {
            value = fromIdentifier(identifier);
        }
        if (value == null) {
            return automaticReplication ? null : UNKNOWN;
        }
        return requireNonEmpty("location", value);
    }

    /**
     * Location configured on a sync target: blank or {@code automatic} is absent for
     * automatically replicated providers, {@code unknown} otherwise.
     */
    public String configuredLocation(String configured, boolean automaticReplication) {
        if (configured == null || configured.isBlank() || AUTOMATIC.equalsIgnoreCase(configured.trim())) {
            return automaticReplication ? null : UNKNOWN;
        }
        return configured.trim();
    }

    static String fromIdentifier(String identifier) {
        Matcher arn = ARN.matcher(identifier);
        if (arn.matches() && !arn.group(1).isEmpty()) {
            return arn.group(1);
        }
        Matcher locations = LOCATIONS_SEGMENT.matcher(identifier);
        if (locations.find()) {
            return locations.group(1);
        }
        return null;
    }

    private static String firstTag(Map<String, String> tags, List<String> keys) {
        if (tags == null) {
            return null;
        }
        for (String key : keys) {
            String value = tags.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static String requireNonEmpty(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "metadata resolved to an empty value");
        }
        return value;
    }
}
