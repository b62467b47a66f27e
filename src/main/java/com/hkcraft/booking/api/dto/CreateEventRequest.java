package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.CraftEvent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Request DTO for creating an event or course.
 * maxParticipants may be omitted for unlimited seats.
 *
 * @author Craft Booking Team
 */
public class CreateEventRequest {

    @NotBlank(message = "Title is required")
    private String title;

    @NotNull(message = "Kind is required")
    private CraftEvent.EventKind kind;

    @NotNull(message = "Start time is required")
    private Instant startsAt;

    @NotNull(message = "End time is required")
    private Instant endsAt;

    private Integer maxParticipants;

    private BigDecimal registrationFee;

    public CreateEventRequest() {
    }

    // Getters and setters
    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public CraftEvent.EventKind getKind() {
        return kind;
    }

    public void setKind(CraftEvent.EventKind kind) {
        this.kind = kind;
    }

    public Instant getStartsAt() {
        return startsAt;
    }

    public void setStartsAt(Instant startsAt) {
        this.startsAt = startsAt;
    }

    public Instant getEndsAt() {
        return endsAt;
    }

    public void setEndsAt(Instant endsAt) {
        this.endsAt = endsAt;
    }

    public Integer getMaxParticipants() {
        return maxParticipants;
    }

    public void setMaxParticipants(Integer maxParticipants) {
        this.maxParticipants = maxParticipants;
    }

    public BigDecimal getRegistrationFee() {
        return registrationFee;
    }

    public void setRegistrationFee(BigDecimal registrationFee) {
        this.registrationFee = registrationFee;
    }
}
