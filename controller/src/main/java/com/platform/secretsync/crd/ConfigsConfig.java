package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Routing of plaintext {@code application.properties} entries to a config store.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfigsConfig {

    private boolean enabled;

    /**
     * AWS Parameter Store path prefix.
     */
    private String parameterPath;

    /**
     * Azure App Configuration endpoint.
     */
    private String appConfigEndpoint;

    /**
     * GCP Parameter Manager location.
     */
    private String location;
}
