package com.hkcraft.booking.exception;

import com.hkcraft.booking.domain.model.ResourceType;

/**
 * Exception thrown when a requested resource (product, event, order, registration) does not exist.
 *
 * @author Craft Booking Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s with ID %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public ResourceNotFoundException(ResourceType resourceType, String resourceId) {
        this(resourceType.getDisplayName(), resourceId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
