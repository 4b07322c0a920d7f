package com.platform.secretsync.provider;

import com.platform.secretsync.canonical.CanonicalSecret;

import java.util.List;
import java.util.Optional;

/**
 * Uniform capability set over one cloud secret store.
 *
 * <p>Implementations translate provider failures into
 * {@link com.platform.secretsync.error.ProviderException} and route every remote call through
 * {@link ProviderCallExecutor}.
 */
public interface ProviderClient extends AutoCloseable {

    ProviderType type();

    /**
     * Creates the secret with {@code secret.value()} as its first version. A secret of the same name
     * that is scheduled for deletion is restored first and receives a new version.
     */
    void create(CanonicalSecret secret);

    /**
     * Appends a new version holding {@code secret.value()} and makes it the current, enabled one.
     */
    void putValue(CanonicalSecret secret);

    /**
     * Points {@code label} at {@code versionId}. No-op for providers without staging labels.
     */
    default void addStagingLabel(String name, String label, String versionId) {
    }

    /**
     * Secrets tagged as managed by the given sync target, without payloads.
     */
    List<ProviderSecretRecord> listActive(String syncTargetTag);

    /**
     * Full record including the payload of the latest enabled version, or empty when the secret
     * does not exist at all.
     */
    Optional<ProviderSecretRecord> getMetadata(String name);

    /**
     * Stops the secret from being served while keeping it recoverable.
     */
    void disable(String name);

    void softDelete(String name);

    void hardDelete(String name);

    @Override
    default void close() {
    }
}
