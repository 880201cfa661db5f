package com.strata.domain;

/**
 * Exception thrown when an operation names a dataset, policy, profile or template that does not exist.
 *
 * HTTP Status Mapping:
 * - REST APIs: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Kind of resource, e.g. "policy"
     */
    private final String resourceType;

    /**
     * Identifier as supplied by the caller
     */
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(resourceType + " not found");
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [" + resourceType + ": " + resourceId + "]";
    }
}
