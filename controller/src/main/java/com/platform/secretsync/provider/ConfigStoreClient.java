package com.platform.secretsync.provider;

import com.platform.secretsync.canonical.ConfigEntry;

import java.util.Optional;

/**
 * Parameter or configuration store that receives non-secret values.
 */
public interface ConfigStoreClient extends AutoCloseable {

    ProviderType type();

    Optional<String> getValue(ConfigEntry entry);

    /**
     * Writes the value, creating the entry or appending a version as the store requires.
     */
    void putValue(ConfigEntry entry);

    @Override
    default void close() {
    }
}
