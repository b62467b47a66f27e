package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.service.WaitlistEntry;

import java.time.Instant;

/**
 * Response DTO for registrations. Position is set for waitlist listings only.
 *
 * @author Craft Booking Team
 */
public class RegistrationResponse {

    private Long registrationId;

    private String eventId;

    private String userId;

    private String status;

    private Integer waitlistPosition;

    private Instant registeredAt;

    private Instant promotedAt;

    private Instant cancelledAt;

    private Instant attendedAt;

    private Integer rating;

    private String feedback;

    public RegistrationResponse() {
    }

    public static RegistrationResponse fromEntity(Registration registration) {
        RegistrationResponse response = new RegistrationResponse();
        response.setRegistrationId(registration.getRegistrationId());
        response.setEventId(registration.getEventId());
        response.setUserId(registration.getUserId());
        response.setStatus(registration.getStatus().name());
        response.setRegisteredAt(registration.getRegisteredAt());
        response.setPromotedAt(registration.getPromotedAt());
        response.setCancelledAt(registration.getCancelledAt());
        response.setAttendedAt(registration.getAttendedAt());
        response.setRating(registration.getRating());
        response.setFeedback(registration.getFeedback());
        return response;
    }

    public static RegistrationResponse fromWaitlistEntry(WaitlistEntry entry) {
        RegistrationResponse response = fromEntity(entry.getRegistration());
        response.setWaitlistPosition(entry.getPosition());
        return response;
    }

    // Getters and setters
    public Long getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(Long registrationId) {
        this.registrationId = registrationId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getWaitlistPosition() {
        return waitlistPosition;
    }

    public void setWaitlistPosition(Integer waitlistPosition) {
        this.waitlistPosition = waitlistPosition;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    public Instant getPromotedAt() {
        return promotedAt;
    }

    public void setPromotedAt(Instant promotedAt) {
        this.promotedAt = promotedAt;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public Instant getAttendedAt() {
        return attendedAt;
    }

    public void setAttendedAt(Instant attendedAt) {
        this.attendedAt = attendedAt;
    }

    public Integer getRating() {
        return rating;
    }

    public void setRating(Integer rating) {
        this.rating = rating;
    }

    public String getFeedback() {
        return feedback;
    }

    public void setFeedback(String feedback) {
        this.feedback = feedback;
    }
}
