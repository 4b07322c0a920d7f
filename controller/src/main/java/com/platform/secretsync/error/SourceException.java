package com.platform.secretsync.error;

/**
 * Exception raised while pulling a snapshot from a GitOps source object.
 */
public class SourceException extends SecretSyncException {

    private final String sourceRef;

    public SourceException(ErrorCode errorCode, String sourceRef, String message) {
        super(errorCode, message);
        this.sourceRef = sourceRef;
    }

    public SourceException(ErrorCode errorCode, String sourceRef, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.sourceRef = sourceRef;
    }

    public static SourceException notFound(String sourceRef, String message) {
        return new SourceException(ErrorCode.SOURCE_NOT_FOUND, sourceRef, message);
    }

    public static SourceException checksumMismatch(String sourceRef, String expected, String actual) {
        return new SourceException(
            ErrorCode.CHECKSUM_MISMATCH,
            sourceRef,
            String.format("Checksum mismatch for %s: expected %s, got %s", sourceRef, expected, actual)
        );
    }

    public static SourceException timeout(String sourceRef, Throwable cause) {
        return new SourceException(
            ErrorCode.SOURCE_TIMEOUT,
            sourceRef,
            "Timed out pulling " + sourceRef,
            cause
        );
    }

    public static SourceException fetchFailed(String sourceRef, String message, Throwable cause) {
        return new SourceException(ErrorCode.SOURCE_FETCH_FAILED, sourceRef, message, cause);
    }

    public String getSourceRef() {
        return sourceRef;
    }
}
