package com.platform.secretsync.crypto;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class KubernetesCredentialReader implements CredentialReader {

    private final KubernetesClient client;

    public KubernetesCredentialReader(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<Map<String, byte[]>> read(String namespace, String name) {
        Secret secret;
        try {
            secret = client.secrets().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
        if (secret == null) {
            return Optional.empty();
        }
        Map<String, byte[]> fields = new HashMap<>();
        if (secret.getData() != null) {
            secret.getData().forEach((field, value) -> fields.put(field, Base64.getMimeDecoder().decode(value)));
        }
        if (secret.getStringData() != null) {
            secret.getStringData().forEach((field, value) -> fields.put(field, value.getBytes(StandardCharsets.UTF_8)));
        }
        return Optional.of(fields);
    }
}
