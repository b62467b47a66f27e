package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.service.RegistrationCancellation;

/**
 * Response DTO for a registration cancellation, naming the promoted user if a seat was handed on.
 *
 * @author Craft Booking Team
 */
public class CancellationResponse {

    private RegistrationResponse registration;

    private String previousStatus;

    private RegistrationResponse promoted;

    public CancellationResponse() {
    }

    public static CancellationResponse fromOutcome(RegistrationCancellation outcome) {
        CancellationResponse response = new CancellationResponse();
        response.setRegistration(RegistrationResponse.fromEntity(outcome.getRegistration()));
        response.setPreviousStatus(outcome.getPreviousStatus().name());
        response.setPromoted(outcome.getPromoted().map(RegistrationResponse::fromEntity).orElse(null));
        return response;
    }

    // Getters and setters
    public RegistrationResponse getRegistration() {
        return registration;
    }

    public void setRegistration(RegistrationResponse registration) {
        this.registration = registration;
    }

    public String getPreviousStatus() {
        return previousStatus;
    }

    public void setPreviousStatus(String previousStatus) {
        this.previousStatus = previousStatus;
    }

    public RegistrationResponse getPromoted() {
        return promoted;
    }

    public void setPromoted(RegistrationResponse promoted) {
        this.promoted = promoted;
    }
}
