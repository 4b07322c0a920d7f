package com.platform.secretsync.provider.azure;

import com.azure.core.exception.ResourceNotFoundException;
import com.azure.core.util.Context;
import com.azure.data.appconfiguration.ConfigurationClient;
import com.azure.data.appconfiguration.models.ConfigurationSetting;
import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.provider.ConfigStoreClient;
import com.platform.secretsync.provider.ProviderCallExecutor;
import com.platform.secretsync.provider.ProviderType;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * App Configuration key-values, labelled with the environment.
 */
@Slf4j
public class AzureAppConfigurationClient implements ConfigStoreClient {

    private final ConfigurationClient client;
    private final ProviderCallExecutor executor;

    public AzureAppConfigurationClient(ConfigurationClient client, ProviderCallExecutor executor) {
        this.client = client;
        this.executor = executor;
    }

    @Override
    public ProviderType type() {
        return ProviderType.AZURE;
    }

    @Override
    public Optional<String> getValue(ConfigEntry entry) {
        return executor.call(type(), "getConfigurationSetting", entry.name(), () -> {
            try {
                ConfigurationSetting setting = client.getConfigurationSetting(entry.name(), entry.label());
                return Optional.ofNullable(setting).map(ConfigurationSetting::getValue);
            } catch (ResourceNotFoundException e) {
                return Optional.empty();
            } catch (RuntimeException e) {
                throw AzureErrors.translate(e, entry.name());
            }
        });
    }

    @Override
    public void putValue(ConfigEntry entry) {
        executor.run(type(), "setConfigurationSetting", entry.name(), () -> {
            try {
                ConfigurationSetting setting = new ConfigurationSetting()
                    .setKey(entry.name())
                    .setLabel(entry.label())
                    .setValue(entry.value())
                    .setContentType(entry.contentType())
                    .setTags(entry.tags());
                client.setConfigurationSettingWithResponse(setting, false, Context.NONE);
                log.info("Wrote App Configuration key {} (label {})", entry.name(), entry.label());
            } catch (RuntimeException e) {
                throw AzureErrors.translate(e, entry.name());
            }
        });
    }
}
