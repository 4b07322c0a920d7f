package com.platform.secretsync.provider;

import com.platform.secretsync.crd.SyncTargetSpec;

/**
 * Selects, and caches, provider clients for a sync target's provider configuration.
 */
public interface ProviderClientFactory extends AutoCloseable {

    ProviderClients forTarget(SyncTargetSpec spec);

    /**
     * Closes every cached client.
     */
    @Override
    void close();
}
