package com.platform.secretsync.provider;

/**
 * Clients serving one sync target.
 *
 * @param configs null when configs are not routed to a config store
 */
public record ProviderClients(ProviderClient secrets, ConfigStoreClient configs) {
}
