package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.CraftEvent;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for events and courses.
 *
 * @author Craft Booking Team
 */
public class EventResponse {

    private String eventId;

    private String organizerId;

    private String title;

    private String kind;

    private String status;

    private Instant startsAt;

    private Instant endsAt;

    private Integer maxParticipants;

    private Integer remainingSeats;

    private BigDecimal registrationFee;

    public EventResponse() {
    }

    public static EventResponse fromEntity(CraftEvent event) {
        EventResponse response = new EventResponse();
        response.setEventId(event.getEventId());
        response.setOrganizerId(event.getOrganizerId());
        response.setTitle(event.getTitle());
        response.setKind(event.getKind().name());
        response.setStatus(event.getStatus().name());
        response.setStartsAt(event.getStartsAt());
        response.setEndsAt(event.getEndsAt());
        response.setMaxParticipants(event.getMaxParticipants());
        response.setRemainingSeats(event.getRemainingSeats());
        response.setRegistrationFee(event.getRegistrationFee());
        return response;
    }

    // Getters and setters
    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getOrganizerId() {
        return organizerId;
    }

    public void setOrganizerId(String organizerId) {
        this.organizerId = organizerId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
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

    public Integer getRemainingSeats() {
        return remainingSeats;
    }

    public void setRemainingSeats(Integer remainingSeats) {
        this.remainingSeats = remainingSeats;
    }

    public BigDecimal getRegistrationFee() {
        return registrationFee;
    }

    public void setRegistrationFee(BigDecimal registrationFee) {
        this.registrationFee = registrationFee;
    }
}
