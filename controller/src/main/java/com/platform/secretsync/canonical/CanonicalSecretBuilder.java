package com.platform.secretsync.canonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.secretsync.crd.ConfigsConfig;
import com.platform.secretsync.crd.ProviderConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetSpec;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.parser.ParsedValue;
import com.platform.secretsync.provider.ProviderType;
import com.platform.secretsync.resolver.EntryClassification;
import com.platform.secretsync.resolver.ParsedEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns parsed files into the deterministic desired state of a sync target.
 */
@Slf4j
@Component
public class CanonicalSecretBuilder {

    public static final String TAG_ENVIRONMENT = "environment";
    public static final String TAG_LOCATION = "location";
    public static final String TAG_MANAGED_BY = "managed-by";
    public static final String TAG_SYNC_TARGET = "sync-target";
    public static final String TAG_SOURCE_PATH = "source-path";
    public static final String MANAGED_BY = "secret-sync";

    static final String PROPERTIES_SECRET_KEY = "properties";

    private final SecretNamer namer;
    private final MetadataNormalizer metadata;
    private final ObjectMapper objectMapper;

    public CanonicalSecretBuilder(SecretNamer namer, MetadataNormalizer metadata, ObjectMapper objectMapper) {
        this.namer = namer;
        this.metadata = metadata;
        this.objectMapper = objectMapper;
    }

    public static String syncTargetTag(SyncTargetKey target) {
        return target.namespace() + "." + target.name();
    }

    public CanonicalSet build(SyncTargetKey target, SyncTargetSpec spec, List<ParsedFile> files) {
        ProviderType provider = spec.getProvider().resolveType();
        String environment = spec.getSecrets().getEnvironment();
        String location = targetLocation(spec.getProvider(), provider);
        String prefix = spec.getSecrets().getPrefix();
        String suffix = spec.getSecrets().getSuffix();
        boolean configsEnabled = spec.getConfigs() != null && spec.getConfigs().isEnabled();

        Map<String, CanonicalSecret> secrets = new LinkedHashMap<>();
        Map<String, String> secretOrigins = new LinkedHashMap<>();
        List<ConfigEntry> configs = new ArrayList<>();
        Map<String, String> configOrigins = new LinkedHashMap<>();

        for (ParsedFile file : files) {
            ParsedEntry entry = file.entry();
            if (entry.profile() != null && !entry.profile().equals(environment)) {
                throw new ValidationException("secrets.environment", environment,
                    "entry " + entry.relativePath() + " was read from profile " + entry.profile());
            }
            String servicePrefix = prefix != null && !prefix.isBlank() ? prefix : entry.serviceName();
            Map<String, String> tags = tags(target, metadata.environment(Map.of(), environment), location,
                entry.relativePath());

            if (entry.classification() == EntryClassification.ENCRYPTED_SECRET) {
                for (ParsedValue value : dedupe(file)) {
                    String name = namer.canonicalName(servicePrefix, value.key(), suffix, provider);
                    register(secretOrigins, name, entry.relativePath() + "#" + value.key());
                    secrets.put(name, new CanonicalSecret(name, value.value(), value.enabled(), value.key(),
                        entry.relativePath(), environment, location, tags));
                }
            } else if (configsEnabled) {
                for (ParsedValue value : dedupe(file)) {
                    ConfigEntry config = configEntry(spec, provider, servicePrefix, suffix, environment, value,
                        entry.relativePath(), tags);
                    register(configOrigins, config.name() + "|" + config.label(), entry.relativePath() + "#" + value.key());
                    configs.add(config);
                }
            } else {
                String name = namer.canonicalName(servicePrefix, PROPERTIES_SECRET_KEY, suffix, provider);
                register(secretOrigins, name, entry.relativePath());
                secrets.put(name, new CanonicalSecret(name, propertiesJson(file), true, PROPERTIES_SECRET_KEY,
                    entry.relativePath(), environment, location, tags));
            }
        }
        log.debug("Built {} secrets and {} config entries for {}", secrets.size(), configs.size(), target);
        return new CanonicalSet(new ArrayList<>(secrets.values()), configs);
    }

    private ConfigEntry configEntry(SyncTargetSpec spec, ProviderType provider, String servicePrefix, String suffix,
                                    String environment, ParsedValue value, String sourcePath,
                                    Map<String, String> tags) {
        ConfigsConfig configs = spec.getConfigs();
        return switch (provider) {
            case AWS -> {
                String path = configs.getParameterPath() != null && !configs.getParameterPath().isBlank()
                    ? configs.getParameterPath()
                    : "/" + servicePrefix + "/" + environment;
                yield new ConfigEntry(namer.parameterName(path, value.key()), value.value(), null, null,
                    sourcePath, tags);
            }
            case AZURE -> new ConfigEntry(namer.appConfigKey(servicePrefix, value.key()), value.value(),
                environment, null, sourcePath, tags);
            case GCP -> new ConfigEntry(namer.canonicalName(servicePrefix, value.key(), suffix, ProviderType.GCP),
                value.value(), null, "text/plain", sourcePath, tags);
        };
    }

    private String targetLocation(ProviderConfig config, ProviderType provider) {
        return switch (provider) {
            case AWS -> metadata.configuredLocation(config.getAws().getRegion(), false);
            case AZURE -> metadata.configuredLocation(config.getAzure().getLocation(), false);
            case GCP -> metadata.configuredLocation(config.getGcp().getLocation(), true);
        };
    }

    private static Map<String, String> tags(SyncTargetKey target, String environment, String location,
                                            String sourcePath) {
        Map<String, String> tags = new TreeMap<>();
        tags.put(TAG_ENVIRONMENT, environment);
        if (location != null) {
            tags.put(TAG_LOCATION, location);
        }
        tags.put(TAG_MANAGED_BY, MANAGED_BY);
        tags.put(TAG_SYNC_TARGET, syncTargetTag(target));
        tags.put(TAG_SOURCE_PATH, sourcePath);
        return tags;
    }

    /**
     * Later occurrences of a key in the same file win.
     */
    private static List<ParsedValue> dedupe(ParsedFile file) {
        Map<String, ParsedValue> byKey = new LinkedHashMap<>();
        for (ParsedValue value : file.values()) {
            if (byKey.put(value.key(), value) != null) {
                log.warn("Key {} appears more than once in {}, using the last value", value.key(),
                    file.entry().relativePath());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private static void register(Map<String, String> origins, String name, String origin) {
        String previous = origins.putIfAbsent(name, origin);
        if (previous != null) {
            throw new ValidationException(ErrorCode.NAME_COLLISION,
                String.format("Name '%s' is produced by both %s and %s", name, previous, origin));
        }
    }

    private String propertiesJson(ParsedFile file) {
        Map<String, String> sorted = new TreeMap<>();
        for (ParsedValue value : file.values()) {
            sorted.put(value.key(), value.value());
        }
        try {
            return objectMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize properties", e);
        }
    }
}
