package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SecretsConfig {

    /**
     * Profile directory name, required.
     */
    private String environment;

    private String basePath;

    private String prefix;

    private String suffix;

    /**
     * Directory of a kustomization below the snapshot root. When set, secrets come from the
     * Secret and ConfigMap objects of its build output instead of the profile directory.
     */
    private String kustomizePath;

    private Decryption decryption;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Decryption {
        private SecretKeyRef secretRef;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SecretKeyRef {
        private String name;
        private String namespace;
        private String key;
    }
}
