package com.hkcraft.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An event or course that users register for.
 * Courses are events of kind {@link EventKind#COURSE}; their seats are {@code maxParticipants}.
 *
 * The event row is also the lock target for registration: registering, cancelling and
 * promoting all lock it first so that the CONFIRMED count read inside the transaction
 * cannot be stale.
 *
 * @author Craft Booking Team
 */
@Entity
@Table(name = "craft_events", indexes = {
    @Index(name = "idx_event_organizer", columnList = "organizer_id"),
    @Index(name = "idx_event_status", columnList = "status"),
    @Index(name = "idx_event_starts_at", columnList = "starts_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CraftEvent implements CapacityResource {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "organizer_id", nullable = false, length = 36)
    private String organizerId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private EventKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private EventStatus status;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    /**
     * Seat cap. Null means unlimited.
     */
    @Column(name = "max_participants")
    private Integer maxParticipants;

    @Column(name = "registration_fee", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal registrationFee = BigDecimal.ZERO;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Remaining seats, computed by the registration service and not persisted.
     */
    @Transient
    private Integer remainingSeats;

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) status = EventStatus.DRAFT;
        if (registrationFee == null) registrationFee = BigDecimal.ZERO;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.EVENT_CAPACITY;
    }

    @Override
    public String getResourceId() {
        return eventId;
    }

    @Override
    public Integer getRemainingCapacity() {
        return remainingSeats;
    }

    public boolean hasCapacityLimit() {
        return maxParticipants != null;
    }

    /**
     * Whether one more CONFIRMED registration fits.
     *
     * @param confirmedCount CONFIRMED registrations counted under the event lock
     */
    public boolean hasSeatFor(long confirmedCount) {
        return !hasCapacityLimit() || confirmedCount < maxParticipants;
    }

    public boolean isRegistrationOpen() {
        return status == EventStatus.REGISTRATION_OPEN;
    }

    public boolean hasEnded(Instant now) {
        return endsAt != null && !now.isBefore(endsAt);
    }

    public boolean requiresFee() {
        return registrationFee != null && registrationFee.signum() > 0;
    }

    public boolean isOrganizedBy(String userId) {
        return organizerId != null && organizerId.equals(userId);
    }

    /**
     * Kinds of craft events.
     */
    public enum EventKind {
        COURSE,
        WORKSHOP,
        EXHIBITION,
        DEMONSTRATION,
        CULTURAL_TOUR,
        ONLINE_WEBINAR
    }

    /**
     * Event lifecycle.
     */
    public enum EventStatus {
        DRAFT,
        PUBLISHED,
        REGISTRATION_OPEN,
        REGISTRATION_CLOSED,
        IN_PROGRESS,
        COMPLETED,
        CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == CANCELLED;
        }
    }
}
