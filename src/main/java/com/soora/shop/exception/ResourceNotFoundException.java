package com.soora.shop.exception;

/**
 * Exception thrown when a requested resource (product, address, order, etc.) is not found,
 * or exists but belongs to another user.
 * The message never carries the ID so that non-owners learn nothing about existence.
 *
 * @author Soora Platform Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s not found", resourceType));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
