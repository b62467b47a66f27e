package com.hkcraft.booking.exception;

import com.hkcraft.booking.domain.model.ResourceType;

/**
 * Exception thrown when a resource exists but is not open for allocation
 * (for example a product that is INACTIVE or OUT_OF_STOCK).
 *
 * @author Craft Booking Team
 */
public class ResourceUnavailableException extends RuntimeException {

    private final ResourceType resourceType;
    private final String resourceId;
    private final String currentStatus;

    public ResourceUnavailableException(ResourceType resourceType, String resourceId, String currentStatus) {
        super(String.format("%s %s is not available (status: %s)",
                resourceType.getDisplayName(), resourceId, currentStatus));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.currentStatus = currentStatus;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
