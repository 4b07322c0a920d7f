package com.platform.secretsync.provider.aws;

import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.provider.ConfigStoreClient;
import com.platform.secretsync.provider.ProviderCallExecutor;
import com.platform.secretsync.provider.ProviderType;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;
import software.amazon.awssdk.services.ssm.model.ParameterType;
import software.amazon.awssdk.services.ssm.model.ResourceTypeForTagging;
import software.amazon.awssdk.services.ssm.model.Tag;

import java.util.Optional;

/**
 * SSM Parameter Store as config store: plain {@code String} parameters, overwritten in place
 * (the service keeps the version history).
 */
@Slf4j
public class AwsParameterStoreClient implements ConfigStoreClient {

    private final SsmClient client;
    private final ProviderCallExecutor executor;

    public AwsParameterStoreClient(SsmClient client, ProviderCallExecutor executor) {
        this.client = client;
        this.executor = executor;
    }

    @Override
    public ProviderType type() {
        return ProviderType.AWS;
    }

    @Override
    public Optional<String> getValue(ConfigEntry entry) {
        return executor.call(type(), "getParameter", entry.name(), () -> {
            try {
                return Optional.of(client.getParameter(b -> b.name(entry.name())).parameter().value());
            } catch (ParameterNotFoundException e) {
                return Optional.empty();
            } catch (SdkException e) {
                throw AwsErrors.translate(e, entry.name());
            }
        });
    }

    @Override
    public void putValue(ConfigEntry entry) {
        executor.run(type(), "putParameter", entry.name(), () -> {
            try {
                Long version = client.putParameter(b -> b.name(entry.name())
                    .value(entry.value())
                    .type(ParameterType.STRING)
                    .overwrite(true)).version();
                client.addTagsToResource(b -> b.resourceType(ResourceTypeForTagging.PARAMETER)
                    .resourceId(entry.name())
                    .tags(entry.tags().entrySet().stream()
                        .map(tag -> Tag.builder().key(tag.getKey()).value(tag.getValue()).build())
                        .toList()));
                log.info("Wrote parameter {} version {}", entry.name(), version);
            } catch (SdkException e) {
                throw AwsErrors.translate(e, entry.name());
            }
        });
    }

    @Override
    public void close() {
        client.close();
    }
}
