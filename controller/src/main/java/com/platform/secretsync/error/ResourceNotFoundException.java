package com.platform.secretsync.error;

/**
 * Exception for API lookups of unknown sync targets.
 */
public class ResourceNotFoundException extends SecretSyncException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException syncTarget(String key) {
        return new ResourceNotFoundException("SyncTarget", key);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
