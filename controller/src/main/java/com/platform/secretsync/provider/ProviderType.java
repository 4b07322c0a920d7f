package com.platform.secretsync.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of supported secret stores.
 */
public enum ProviderType {
    AWS("aws"),
    AZURE("azure"),
    GCP("gcp");

    private final String id;

    ProviderType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ProviderType fromId(String value) {
        for (ProviderType type : values()) {
            if (type.id.equals(value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider type: " + value);
    }
}
