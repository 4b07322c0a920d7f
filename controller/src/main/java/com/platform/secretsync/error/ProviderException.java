package com.platform.secretsync.error;

/**
 * Exception for cloud provider API errors, normalized across AWS, Azure and GCP.
 */
public class ProviderException extends SecretSyncException {

    private final String provider;
    private final String resourceName;

    public ProviderException(ErrorCode errorCode, String provider, String resourceName, String message) {
        super(errorCode, message);
        this.provider = provider;
        this.resourceName = resourceName;
    }

    public ProviderException(ErrorCode errorCode, String provider, String resourceName, String message,
                             Throwable cause) {
        super(errorCode, message, cause);
        this.provider = provider;
        this.resourceName = resourceName;
    }

    /**
     * Classifies an HTTP-style status code returned by a provider.
     */
    public static ProviderException fromStatus(int status, String provider, String resourceName,
                                               String message, Throwable cause) {
        ErrorCode code;
        if (status == 401 || status == 403) {
            code = ErrorCode.PROVIDER_AUTH_FAILED;
        } else if (status == 404) {
            code = ErrorCode.PROVIDER_NOT_FOUND;
        } else if (status == 429) {
            code = ErrorCode.PROVIDER_THROTTLED;
        } else if (status >= 500) {
            code = ErrorCode.PROVIDER_UNAVAILABLE;
        } else if (status >= 400) {
            code = ErrorCode.PROVIDER_REQUEST_INVALID;
        } else {
            code = ErrorCode.PROVIDER_ERROR;
        }
        return new ProviderException(code, provider, resourceName,
            String.format("%s call for %s failed (%d): %s", provider, resourceName, status, message), cause);
    }

    public static ProviderException auth(String provider, String resourceName, Throwable cause) {
        return new ProviderException(ErrorCode.PROVIDER_AUTH_FAILED, provider, resourceName,
            String.format("%s denied access to %s: %s", provider, resourceName, cause.getMessage()), cause);
    }

    public boolean isNotFound() {
        return getErrorCode() == ErrorCode.PROVIDER_NOT_FOUND;
    }

    public boolean isAuthFailure() {
        return getErrorCode() == ErrorCode.PROVIDER_AUTH_FAILED;
    }

    public String getProvider() {
        return provider;
    }

    public String getResourceName() {
        return resourceName;
    }
}
