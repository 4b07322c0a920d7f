package com.platform.secretsync.error;

import java.nio.file.Path;

/**
 * Exception raised when the service root or environment profile cannot be located in a snapshot,
 * or when the kustomization of a target cannot be built.
 */
public class ResolutionException extends SecretSyncException {

    private final Path searchedPath;

    public ResolutionException(ErrorCode errorCode, Path searchedPath, String message) {
        super(errorCode, message);
        this.searchedPath = searchedPath;
    }

    public ResolutionException(ErrorCode errorCode, Path searchedPath, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.searchedPath = searchedPath;
    }

    public static ResolutionException kustomizeFailed(Path kustomization, String message) {
        return kustomizeFailed(kustomization, message, null);
    }

    public static ResolutionException kustomizeFailed(Path kustomization, String message, Throwable cause) {
        return new ResolutionException(
            ErrorCode.KUSTOMIZE_BUILD_FAILED,
            kustomization,
            String.format("kustomize build %s: %s", kustomization, message),
            cause
        );
    }

    public static ResolutionException serviceNotFound(Path searchedPath) {
        return new ResolutionException(
            ErrorCode.SERVICE_NOT_FOUND,
            searchedPath,
            "No service directory found under " + searchedPath
        );
    }

    public static ResolutionException profileNotFound(String environment, Path searchedPath) {
        return new ResolutionException(
            ErrorCode.PROFILE_NOT_FOUND,
            searchedPath,
            String.format("Profile '%s' not found at %s", environment, searchedPath)
        );
    }

    public Path getSearchedPath() {
        return searchedPath;
    }
}
