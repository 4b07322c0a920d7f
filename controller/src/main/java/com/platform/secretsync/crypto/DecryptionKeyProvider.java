package com.platform.secretsync.crypto;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.SecretsConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.DecryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of raw SOPS key bytes per sync target.
 *
 * <p>Entries are read-only and dropped through {@link #invalidate(String, String)} when the backing
 * Secret changes. Callers receive a fresh copy wrapped in {@link KeyMaterial} for each decrypt call.
 */
@Slf4j
@Component
public class DecryptionKeyProvider {

    private final CredentialReader reader;
    private final SecretSyncProperties.Decryption settings;
    private final Map<SyncTargetKey, CachedKey> cache = new ConcurrentHashMap<>();

    public DecryptionKeyProvider(CredentialReader reader, SecretSyncProperties properties) {
        this.reader = reader;
        this.settings = properties.getDecryption();
    }

    /**
     * Returns key material for {@code target}, reading the credential on a cache miss.
     *
     * @param secretRef explicit reference from the target, may be null
     * @throws DecryptionException with {@code KEY_NOT_FOUND} when no credential holds a key
     */
    public KeyMaterial open(SyncTargetKey target, SecretsConfig.SecretKeyRef secretRef) {
        String reference = describe(target, secretRef);
        CachedKey cached = cache.get(target);
        if (cached == null || !cached.reference().equals(reference)) {
            cached = load(target, secretRef, reference);
            cache.put(target, cached);
        }
        return KeyMaterial.of(cached.bytes().clone(), cached.namespace() + "/" + cached.name());
    }

    /**
     * Whether a key can currently be found for {@code target}, without throwing.
     */
    public boolean isAvailable(SyncTargetKey target, SecretsConfig.SecretKeyRef secretRef) {
        try (KeyMaterial ignored = open(target, secretRef)) {
            return true;
        } catch (DecryptionException e) {
            return false;
        }
    }

    /**
     * Drops every cached key read from the given Secret.
     *
     * @return targets whose cached key was dropped
     */
    public Set<SyncTargetKey> invalidate(String namespace, String name) {
        Set<SyncTargetKey> affected = new HashSet<>();
        cache.entrySet().removeIf(entry -> {
            boolean matches = entry.getValue().namespace().equals(namespace) && entry.getValue().name().equals(name);
            if (matches) {
                affected.add(entry.getKey());
            }
            return matches;
        });
        if (!affected.isEmpty()) {
            log.info("Key Secret {}/{} changed, invalidated cached keys for {} targets", namespace, name, affected.size());
        }
        return affected;
    }

    /**
     * Whether a change to the given Secret can affect key lookup for targets without an explicit reference.
     */
    public boolean isDefaultKeySecret(String namespace, String name) {
        return settings.getControllerNamespace().equals(namespace) && settings.getSecretNames().contains(name);
    }

    public void evict(SyncTargetKey target) {
        cache.remove(target);
    }

    private CachedKey load(SyncTargetKey target, SecretsConfig.SecretKeyRef secretRef, String reference) {
        if (secretRef != null && secretRef.getName() != null && !secretRef.getName().isBlank()) {
            String namespace = secretRef.getNamespace() != null ? secretRef.getNamespace() : target.namespace();
            List<String> fields = secretRef.getKey() != null ? List.of(secretRef.getKey()) : settings.getSecretFields();
            Map<String, byte[]> data = reader.read(namespace, secretRef.getName())
                .orElseThrow(() -> DecryptionException.keyNotFound(
                    "Decryption Secret " + namespace + "/" + secretRef.getName() + " does not exist"));
            return firstField(data, fields)
                .map(bytes -> new CachedKey(reference, namespace, secretRef.getName(), bytes))
                .orElseThrow(() -> DecryptionException.keyNotFound(
                    "Decryption Secret " + namespace + "/" + secretRef.getName() + " has none of the fields " + fields));
        }

        String namespace = settings.getControllerNamespace();
        for (String name : settings.getSecretNames()) {
            Optional<byte[]> key = reader.read(namespace, name)
                .flatMap(data -> firstField(data, settings.getSecretFields()));
            if (key.isPresent()) {
                log.info("Loaded SOPS key for {} from {}/{}", target, namespace, name);
                return new CachedKey(reference, namespace, name, key.get());
            }
        }
        throw DecryptionException.keyNotFound("No SOPS key found in namespace " + namespace
            + " (looked for " + settings.getSecretNames() + ")");
    }

    private static Optional<byte[]> firstField(Map<String, byte[]> data, List<String> fields) {
        return fields.stream()
            .map(data::get)
            .filter(Objects::nonNull)
            .filter(bytes -> bytes.length > 0)
            .findFirst();
    }

    private static String describe(SyncTargetKey target, SecretsConfig.SecretKeyRef secretRef) {
        if (secretRef == null || secretRef.getName() == null) {
            return "default";
        }
        return Objects.requireNonNullElse(secretRef.getNamespace(), target.namespace())
            + "/" + secretRef.getName() + "#" + secretRef.getKey();
    }

    private record CachedKey(String reference, String namespace, String name, byte[] bytes) {
    }
}
