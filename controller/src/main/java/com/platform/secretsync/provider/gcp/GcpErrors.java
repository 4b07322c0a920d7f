package com.platform.secretsync.provider.gcp;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;

/**
 * Maps gRPC status codes and REST statuses onto {@link ProviderException} kinds.
 */
final class GcpErrors {

    static final String PROVIDER = "gcp";

    private GcpErrors() {
    }

    static ProviderException translate(RuntimeException e, String resource) {
        if (e instanceof ProviderException provider) {
            return provider;
        }
        if (e instanceof ApiException api) {
            StatusCode.Code code = api.getStatusCode().getCode();
            return switch (code) {
                case UNAUTHENTICATED, PERMISSION_DENIED -> ProviderException.auth(PROVIDER, resource, e);
                case DEADLINE_EXCEEDED, UNAVAILABLE, INTERNAL, ABORTED -> new ProviderException(
                    ErrorCode.PROVIDER_UNAVAILABLE, PROVIDER, resource, code + ": " + e.getMessage(), e);
                default -> ProviderException.fromStatus(code.getHttpStatusCode(), PROVIDER, resource,
                    e.getMessage(), e);
            };
        }
        return new ProviderException(ErrorCode.PROVIDER_ERROR, PROVIDER, resource, e.getMessage(), e);
    }
}
