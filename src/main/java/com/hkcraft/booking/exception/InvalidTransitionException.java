package com.hkcraft.booking.exception;

/**
 * Exception thrown when a state change is not allowed from the current state.
 *
 * @author Craft Booking Team
 */
public class InvalidTransitionException extends RuntimeException {

    private final String entityType;
    private final String entityId;
    private final String fromState;
    private final String toState;

    public InvalidTransitionException(String entityType, String entityId, String fromState, String toState) {
        this(entityType, entityId, fromState, toState, null);
    }

    public InvalidTransitionException(String entityType, String entityId, String fromState, String toState,
                                      String detail) {
        super(String.format("%s %s cannot move from %s to %s%s",
                entityType, entityId, fromState, toState, detail == null ? "" : ": " + detail));
        this.entityType = entityType;
        this.entityId = entityId;
        this.fromState = fromState;
        this.toState = toState;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getFromState() {
        return fromState;
    }

    public String getToState() {
        return toState;
    }
}
