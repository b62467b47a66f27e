package com.hkcraft.booking.exception;

/**
 * Exception thrown when a user already has a registration row for an event, whatever its status.
 *
 * @author Craft Booking Team
 */
public class AlreadyRegisteredException extends RuntimeException {

    private final String eventId;
    private final String userId;
    private final String existingStatus;

    public AlreadyRegisteredException(String eventId, String userId, String existingStatus) {
        super(String.format("User %s is already registered for event %s (status: %s)",
                userId, eventId, existingStatus));
        this.eventId = eventId;
        this.userId = userId;
        this.existingStatus = existingStatus;
    }

    public String getEventId() {
        return eventId;
    }

    public String getUserId() {
        return userId;
    }

    public String getExistingStatus() {
        return existingStatus;
    }
}
