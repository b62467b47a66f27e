package com.hkcraft.booking.exception;

/**
 * Exception thrown when an actor operates on a resource it does not own.
 *
 * @author Craft Booking Team
 */
public class ResourceAccessDeniedException extends RuntimeException {

    private final String actorId;
    private final String resourceType;
    private final String resourceId;

    public ResourceAccessDeniedException(String actorId, String resourceType, String resourceId) {
        super(String.format("Access denied: user %s cannot act on %s %s", actorId, resourceType, resourceId));
        this.actorId = actorId;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getActorId() {
        return actorId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
