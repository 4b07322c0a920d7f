package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.provider.ProviderType;
import lombok.Data;

/**
 * Tagged provider variant. Exactly one of {@code aws}, {@code azure}, {@code gcp} is set.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderConfig {

    private ProviderType type;

    private Aws aws;

    private Azure azure;

    private Gcp gcp;

    /**
     * Resolves the configured variant, rejecting ambiguous or mismatched declarations.
     */
    public ProviderType resolveType() {
        int declared = (aws != null ? 1 : 0) + (azure != null ? 1 : 0) + (gcp != null ? 1 : 0);
        if (declared != 1) {
            throw new ValidationException("provider", declared,
                "exactly one of aws, azure or gcp must be configured");
        }
        ProviderType actual = aws != null ? ProviderType.AWS : azure != null ? ProviderType.AZURE : ProviderType.GCP;
        if (type != null && type != actual) {
            throw new ValidationException("provider.type", type, "does not match configured block " + actual);
        }
        return actual;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Aws {
        private String region;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Azure {
        private String vaultName;

        private String location;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Gcp {
        private String projectId;

        /**
         * Replica location; absent means automatic replication.
         */
        private String location;
    }
}
