package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to the GitOps object that publishes the repository content.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceRef {

    public static final String FLUX_GIT_REPOSITORY = "GitRepository";
    public static final String ARGOCD_APPLICATION = "Application";

    private String kind = FLUX_GIT_REPOSITORY;

    private String name;

    private String namespace;

    public String describe(String defaultNamespace) {
        return String.format("%s/%s/%s", kind, namespace != null ? namespace : defaultNamespace, name);
    }
}
