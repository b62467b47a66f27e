package com.hkcraft.booking.exception;

/**
 * Exception thrown when a transactional unit kept hitting lock or serialization
 * conflicts and the retry budget ran out. Safe for the caller to retry later.
 *
 * @author Craft Booking Team
 */
public class TransientConflictException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public TransientConflictException(String operation, int attempts, Throwable cause) {
        super(String.format("Operation %s could not complete after %d attempts due to concurrent updates",
                operation, attempts), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
