package com.platform.secretsync.provider;

import com.azure.core.credential.TokenCredential;
import com.azure.data.appconfiguration.ConfigurationClientBuilder;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.security.keyvault.secrets.SecretClientBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.platform.secretsync.canonical.MetadataNormalizer;
import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.ConfigsConfig;
import com.platform.secretsync.crd.ProviderConfig;
import com.platform.secretsync.crd.SyncTargetSpec;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;
import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.provider.aws.AwsParameterStoreClient;
import com.platform.secretsync.provider.aws.AwsSecretsManagerClient;
import com.platform.secretsync.provider.azure.AzureAppConfigurationClient;
import com.platform.secretsync.provider.azure.AzureKeyVaultClient;
import com.platform.secretsync.provider.gcp.GcpParameterManagerClient;
import com.platform.secretsync.provider.gcp.GcpSecretManagerClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.SsmClientBuilder;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds SDK clients from a sync target's provider block, sharing them between targets that point
 * at the same account and store.
 */
@Slf4j
@Component
public class DefaultProviderClientFactory implements ProviderClientFactory {

    private static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    private final ProviderCallExecutor executor;
    private final MetadataNormalizer metadata;
    private final ObjectMapper objectMapper;
    private final SecretSyncProperties.Providers properties;
    private final Map<String, ProviderClients> clients = new ConcurrentHashMap<>();

    private volatile TokenCredential azureCredential;
    private volatile GoogleCredentials googleCredentials;

    public DefaultProviderClientFactory(ProviderCallExecutor executor, MetadataNormalizer metadata,
                                        ObjectMapper objectMapper, SecretSyncProperties properties) {
        this.executor = executor;
        this.metadata = metadata;
        this.objectMapper = objectMapper;
        this.properties = properties.getProviders();
    }

    @Override
    public ProviderClients forTarget(SyncTargetSpec spec) {
        ProviderConfig provider = spec.getProvider();
        ProviderType type = provider.resolveType();
        ConfigsConfig configs = spec.getConfigs() != null && spec.getConfigs().isEnabled() ? spec.getConfigs() : null;
        return clients.computeIfAbsent(signature(type, provider, configs), key -> {
            log.info("Creating {} clients for {}", type.id(), key);
            return switch (type) {
                case AWS -> aws(provider.getAws(), configs);
                case AZURE -> azure(provider.getAzure(), configs);
                case GCP -> gcp(provider.getGcp(), configs);
            };
        });
    }

    static String signature(ProviderType type, ProviderConfig provider, ConfigsConfig configs) {
        String account = switch (type) {
            case AWS -> provider.getAws().getRegion();
            case AZURE -> provider.getAzure().getVaultName();
            case GCP -> provider.getGcp().getProjectId() + "@" + provider.getGcp().getLocation();
        };
        String store = configs == null ? "-" : configs.getAppConfigEndpoint() + "@" + configs.getLocation();
        return type.id() + ":" + account + ":" + store;
    }

    private ProviderClients aws(ProviderConfig.Aws aws, ConfigsConfig configs) {
        if (aws.getRegion() == null || aws.getRegion().isBlank()) {
            throw new ValidationException("provider.aws.region", "region is required");
        }
        Region region = Region.of(aws.getRegion());
        ClientOverrideConfiguration overrides = ClientOverrideConfiguration.builder()
            .apiCallTimeout(properties.getCallTimeout())
            .build();

        SecretsManagerClientBuilder secrets = SecretsManagerClient.builder()
            .region(region)
            .credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(overrides);
        if (properties.getAwsEndpoint() != null) {
            secrets.endpointOverride(properties.getAwsEndpoint());
        }
        AwsSecretsManagerClient secretClient = new AwsSecretsManagerClient(secrets.build(), executor, metadata,
            properties.getAwsRecoveryWindowDays());

        AwsParameterStoreClient configClient = null;
        if (configs != null) {
            SsmClientBuilder ssm = SsmClient.builder()
                .region(region)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(overrides);
            if (properties.getAwsEndpoint() != null) {
                ssm.endpointOverride(properties.getAwsEndpoint());
            }
            configClient = new AwsParameterStoreClient(ssm.build(), executor);
        }
        return new ProviderClients(secretClient, configClient);
    }

    private ProviderClients azure(ProviderConfig.Azure azure, ConfigsConfig configs) {
        if (azure.getVaultName() == null || azure.getVaultName().isBlank()) {
            throw new ValidationException("provider.azure.vaultName", "vault name is required");
        }
        TokenCredential credential = azureCredential();
        AzureKeyVaultClient secretClient = new AzureKeyVaultClient(new SecretClientBuilder()
            .vaultUrl("https://" + azure.getVaultName() + ".vault.azure.net")
            .credential(credential)
            .buildClient(), executor, metadata);

        AzureAppConfigurationClient configClient = null;
        if (configs != null) {
            if (configs.getAppConfigEndpoint() == null || configs.getAppConfigEndpoint().isBlank()) {
                throw new ValidationException("configs.appConfigEndpoint", "required when configs are enabled on Azure");
            }
            configClient = new AzureAppConfigurationClient(new ConfigurationClientBuilder()
                .endpoint(configs.getAppConfigEndpoint())
                .credential(credential)
                .buildClient(), executor);
        }
        return new ProviderClients(secretClient, configClient);
    }

    private ProviderClients gcp(ProviderConfig.Gcp gcp, ConfigsConfig configs) {
        if (gcp.getProjectId() == null || gcp.getProjectId().isBlank()) {
            throw new ValidationException("provider.gcp.projectId", "project id is required");
        }
        SecretManagerServiceClient client;
        try {
            client = SecretManagerServiceClient.create();
        } catch (IOException e) {
            throw new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, ProviderType.GCP.id(), gcp.getProjectId(),
                "Failed to create Secret Manager client: " + e.getMessage(), e);
        }
        GcpSecretManagerClient secretClient = new GcpSecretManagerClient(client, executor, metadata,
            gcp.getProjectId(), metadata.configuredLocation(gcp.getLocation(), true));

        GcpParameterManagerClient configClient = null;
        if (configs != null) {
            GoogleCredentials credentials = googleCredentials(gcp.getProjectId());
            HttpClient httpClient = HttpClient.newBuilder().connectTimeout(properties.getCallTimeout()).build();
            configClient = new GcpParameterManagerClient(httpClient, objectMapper, executor,
                () -> accessToken(credentials), properties.getGcpParameterManagerEndpoint(), gcp.getProjectId(),
                configs.getLocation(), properties.getCallTimeout());
        }
        return new ProviderClients(secretClient, configClient);
    }

    private TokenCredential azureCredential() {
        if (azureCredential == null) {
            synchronized (this) {
                if (azureCredential == null) {
                    azureCredential = new DefaultAzureCredentialBuilder().build();
                }
            }
        }
        return azureCredential;
    }

    private GoogleCredentials googleCredentials(String projectId) {
        if (googleCredentials == null) {
            synchronized (this) {
                if (googleCredentials == null) {
                    try {
                        googleCredentials = GoogleCredentials.getApplicationDefault().createScoped(CLOUD_PLATFORM_SCOPE);
                    } catch (IOException e) {
                        throw ProviderException.auth(ProviderType.GCP.id(), projectId, e);
                    }
                }
            }
        }
        return googleCredentials;
    }

    private static String accessToken(GoogleCredentials credentials) {
        try {
            credentials.refreshIfExpired();
            return credentials.getAccessToken().getTokenValue();
        } catch (IOException e) {
            throw ProviderException.auth(ProviderType.GCP.id(), "access-token", e);
        }
    }

    @Override
    public void close() {
        clients.forEach((key, pair) -> {
            closeQuietly(key, pair.secrets());
            if (pair.configs() != null) {
                closeQuietly(key, pair.configs());
            }
        });
        clients.clear();
    }

    private static void closeQuietly(String key, AutoCloseable client) {
        try {
            client.close();
        } catch (Exception e) {
            log.warn("Failed to close provider client {}: {}", key, e.getMessage());
        }
    }
}
