package com.platform.secretsync.provider.aws;

import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Maps AWS SDK failures onto {@link ProviderException} kinds.
 */
final class AwsErrors {

    static final String PROVIDER = "aws";

    private AwsErrors() {
    }

    static ProviderException translate(SdkException e, String resource) {
        if (e instanceof AwsServiceException service) {
            String message = service.awsErrorDetails() != null
                ? service.awsErrorDetails().errorMessage()
                : service.getMessage();
            if (service.isThrottlingException()) {
                return ProviderException.fromStatus(429, PROVIDER, resource, message, e);
            }
            return ProviderException.fromStatus(service.statusCode(), PROVIDER, resource, message, e);
        }
        if (e instanceof SdkClientException) {
            return new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, PROVIDER, resource,
                "AWS endpoint unreachable: " + e.getMessage(), e);
        }
        return new ProviderException(ErrorCode.PROVIDER_ERROR, PROVIDER, resource, e.getMessage(), e);
    }
}
