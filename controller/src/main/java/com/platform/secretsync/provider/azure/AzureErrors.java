package com.platform.secretsync.provider.azure;

import com.azure.core.exception.ClientAuthenticationException;
import com.azure.core.exception.HttpResponseException;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;

import java.io.UncheckedIOException;

/**
 * Maps Azure SDK failures onto {@link ProviderException} kinds.
 */
final class AzureErrors {

    static final String PROVIDER = "azure";

    private AzureErrors() {
    }

    static boolean hasStatus(RuntimeException e, int status) {
        return e instanceof HttpResponseException http
            && http.getResponse() != null
            && http.getResponse().getStatusCode() == status;
    }

    static ProviderException translate(RuntimeException e, String resource) {
        if (e instanceof ProviderException provider) {
            return provider;
        }
        if (e instanceof ClientAuthenticationException) {
            return ProviderException.auth(PROVIDER, resource, e);
        }
        if (e instanceof HttpResponseException http && http.getResponse() != null) {
            return ProviderException.fromStatus(http.getResponse().getStatusCode(), PROVIDER, resource,
                e.getMessage(), e);
        }
        if (e instanceof UncheckedIOException) {
            return new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, PROVIDER, resource,
                "Azure endpoint unreachable: " + e.getMessage(), e);
        }
        return new ProviderException(ErrorCode.PROVIDER_ERROR, PROVIDER, resource, e.getMessage(), e);
    }
}
