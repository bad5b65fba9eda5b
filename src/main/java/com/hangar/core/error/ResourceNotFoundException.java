package com.hangar.core.error;

/**
 * Thrown when a project, backup archive or credential record does not exist.
 */
public class ResourceNotFoundException extends HangarException {

    private final String resourceType;
    private final String key;

    public ResourceNotFoundException(String resourceType, String key) {
        super(resourceType + " not found: " + key);
        this.resourceType = resourceType;
        this.key = key;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getKey() {
        return key;
    }
}
