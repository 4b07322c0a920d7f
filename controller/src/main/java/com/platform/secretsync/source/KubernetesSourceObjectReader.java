package com.platform.secretsync.source;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class KubernetesSourceObjectReader implements SourceObjectReader {

    private final KubernetesClient client;

    public KubernetesSourceObjectReader(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<GenericKubernetesResource> find(String apiVersion, String kind, String namespace, String name) {
        try {
            return Optional.ofNullable(client.genericKubernetesResources(apiVersion, kind)
                .inNamespace(namespace)
                .withName(name)
                .get());
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }
}
