package com.platform.secretsync.crypto;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.SecretsConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.DecryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DecryptionKeyProviderTest {

    private static final SyncTargetKey TARGET = new SyncTargetKey("team-a", "billing");

    @Mock
    private CredentialReader reader;

    private DecryptionKeyProvider provider;
    private String identityFile;

    @BeforeEach
    void setUp() {
        provider = new DecryptionKeyProvider(reader, new SecretSyncProperties());
        identityFile = new SopsFixture().identityFile();
    }

    @Test
    void fallsBackToControllerNamespaceSecrets() {
        when(reader.read("secret-sync-system", "sops-private-key")).thenReturn(Optional.empty());
        when(reader.read("secret-sync-system", "sops-gpg-key"))
            .thenReturn(Optional.of(Map.of("age-key", utf8(identityFile))));

        try (KeyMaterial key = provider.open(TARGET, null)) {
            assertThat(key.kind()).isEqualTo(KeyMaterial.Kind.AGE);
            assertThat(key.source()).isEqualTo("secret-sync-system/sops-gpg-key");
        }
    }

    @Test
    void explicitReferenceDefaultsToTargetNamespace() {
        when(reader.read("team-a", "billing-sops")).thenReturn(Optional.of(Map.of("keys.txt", utf8(identityFile))));

        try (KeyMaterial key = provider.open(TARGET, ref("billing-sops", "keys.txt"))) {
            assertThat(key.source()).isEqualTo("team-a/billing-sops");
        }
    }

    @Test
    void cachesUntilInvalidated() {
        when(reader.read("team-a", "billing-sops")).thenReturn(Optional.of(Map.of("key", utf8(identityFile))));
        SecretsConfig.SecretKeyRef ref = ref("billing-sops", null);

        provider.open(TARGET, ref).close();
        provider.open(TARGET, ref).close();
        assertThat(provider.invalidate("team-a", "other")).isEmpty();
        assertThat(provider.invalidate("team-a", "billing-sops")).containsExactly(TARGET);
        provider.open(TARGET, ref).close();

        verify(reader, times(2)).read("team-a", "billing-sops");
    }

    @Test
    void closingKeyMaterialDoesNotCorruptTheCache() {
        when(reader.read("team-a", "billing-sops")).thenReturn(Optional.of(Map.of("key", utf8(identityFile))));
        SecretsConfig.SecretKeyRef ref = ref("billing-sops", null);

        provider.open(TARGET, ref).close();

        try (KeyMaterial again = provider.open(TARGET, ref)) {
            assertThat(again.asText()).isEqualTo(identityFile);
        }
    }

    @Test
    void missingKeyIsKeyNotFound() {
        when(reader.read(anyString(), anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> provider.open(TARGET, null))
            .isInstanceOfSatisfying(DecryptionException.class, e -> assertThat(e.isKeyMissing()).isTrue());
        assertThat(provider.isAvailable(TARGET, null)).isFalse();
    }

    @Test
    void secretWithoutKnownFieldIsKeyNotFound() {
        when(reader.read("team-a", "billing-sops")).thenReturn(Optional.of(Map.of("unrelated", utf8("x"))));

        assertThatThrownBy(() -> provider.open(TARGET, ref("billing-sops", null)))
            .isInstanceOfSatisfying(DecryptionException.class, e -> assertThat(e.isKeyMissing()).isTrue());
    }

    @Test
    void recognisesDefaultKeySecrets() {
        assertThat(provider.isDefaultKeySecret("secret-sync-system", "sops-private-key")).isTrue();
        assertThat(provider.isDefaultKeySecret("team-a", "sops-private-key")).isFalse();
    }

    private static SecretsConfig.SecretKeyRef ref(String name, String key) {
        SecretsConfig.SecretKeyRef ref = new SecretsConfig.SecretKeyRef();
        ref.setName(name);
        ref.setKey(key);
        return ref;
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
