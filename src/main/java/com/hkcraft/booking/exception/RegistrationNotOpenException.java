package com.hkcraft.booking.exception;

/**
 * Exception thrown when registering for an event that is not accepting registrations.
 *
 * @author Craft Booking Team
 */
public class RegistrationNotOpenException extends RuntimeException {

    private final String eventId;
    private final String eventStatus;

    public RegistrationNotOpenException(String eventId, String eventStatus) {
        super(String.format("Registration is not open for event %s (status: %s)", eventId, eventStatus));
        this.eventId = eventId;
        this.eventStatus = eventStatus;
    }

    public String getEventId() {
        return eventId;
    }

    public String getEventStatus() {
        return eventStatus;
    }
}
