package com.hkcraft.booking.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when input is malformed or inconsistent. Nothing it interrupts is committed.
 *
 * @author Craft Booking Team
 */
public class ValidationFailedException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public ValidationFailedException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationFailedException(String message, Map<String, String> fieldErrors) {
        super(message);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
