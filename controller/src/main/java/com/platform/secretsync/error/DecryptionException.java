package com.platform.secretsync.error;

/**
 * Exception raised by the secret decryptor.
 */
public class DecryptionException extends SecretSyncException {

    public DecryptionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public DecryptionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static DecryptionException keyNotFound(String message) {
        return new DecryptionException(ErrorCode.KEY_NOT_FOUND, message);
    }

    public static DecryptionException failed(String message, Throwable cause) {
        return new DecryptionException(ErrorCode.DECRYPTION_FAILED, message, cause);
    }

    public static DecryptionException failed(String message) {
        return new DecryptionException(ErrorCode.DECRYPTION_FAILED, message);
    }

    public static DecryptionException unsupported(String message) {
        return new DecryptionException(ErrorCode.UNSUPPORTED_ENVELOPE, message);
    }

    public boolean isKeyMissing() {
        return getErrorCode() == ErrorCode.KEY_NOT_FOUND;
    }
}
