package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.domain.model.Registration.RegistrationStatus;

import java.util.Optional;

/**
 * Outcome of cancelling a registration: the cancelled row, the status it had before,
 * and the waitlisted registration that took the freed seat, if any.
 *
 * @author Craft Booking Team
 */
public final class RegistrationCancellation {

    private final Registration registration;
    private final RegistrationStatus previousStatus;
    private final Registration promoted;

    public RegistrationCancellation(Registration registration, RegistrationStatus previousStatus,
                                    Registration promoted) {
        this.registration = registration;
        this.previousStatus = previousStatus;
        this.promoted = promoted;
    }

    public Registration getRegistration() {
        return registration;
    }

    public RegistrationStatus getPreviousStatus() {
        return previousStatus;
    }

    public Optional<Registration> getPromoted() {
        return Optional.ofNullable(promoted);
    }

    /**
     * False when the registration was already cancelled and nothing changed.
     */
    public boolean isChanged() {
        return previousStatus != RegistrationStatus.CANCELLED;
    }
}
