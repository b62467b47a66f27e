package com.hkcraft.booking.exception;

import com.hkcraft.booking.domain.model.ResourceType;

/**
 * Exception thrown when a resource holds fewer units than requested.
 *
 * @author Craft Booking Team
 */
public class InsufficientCapacityException extends RuntimeException {

    private final ResourceType resourceType;
    private final String resourceId;
    private final Integer requestedQuantity;
    private final Integer availableQuantity;

    public InsufficientCapacityException(ResourceType resourceType, String resourceId,
                                         Integer requestedQuantity, Integer availableQuantity) {
        super(String.format("Insufficient capacity for %s %s. Requested: %d, Available: %d",
                resourceType.getDisplayName(), resourceId, requestedQuantity, availableQuantity));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public Integer getRequestedQuantity() {
        return requestedQuantity;
    }

    public Integer getAvailableQuantity() {
        return availableQuantity;
    }
}
