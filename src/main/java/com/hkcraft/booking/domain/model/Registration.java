package com.hkcraft.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A user's registration for an event or course.
 * At most one row exists per (event, user) pair.
 *
 * Lifecycle:
 * <pre>
 *   create ──► CONFIRMED ──► ATTENDED (feedback once)
 *         │        │    └──► NO_SHOW
 *         │        └──► CANCELLED (promotes oldest WAITLISTED)
 *         └──► WAITLISTED ──► CONFIRMED (promotion)
 *                   └──► CANCELLED
 * </pre>
 *
 * The identity column doubles as the tie-break for waitlist order when
 * two registrations share the same registeredAt.
 *
 * @author Craft Booking Team
 */
@Entity
@Table(name = "event_registrations",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_registration_event_user", columnNames = {"event_id", "user_id"})
    },
    indexes = {
        @Index(name = "idx_registration_event_status", columnList = "event_id, status"),
        @Index(name = "idx_registration_user", columnList = "user_id"),
        @Index(name = "idx_registration_registered_at", columnList = "registered_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Registration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "registration_id")
    private Long registrationId;

    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RegistrationStatus status;

    /**
     * Position key for the waitlist; reset when a cancelled registration is reactivated.
     */
    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "promoted_at")
    private Instant promotedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "attended_at")
    private Instant attendedAt;

    @Column(name = "feedback", length = 2000)
    private String feedback;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "feedback_submitted_at")
    private Instant feedbackSubmittedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (registeredAt == null) {
            registeredAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isConfirmed() {
        return status == RegistrationStatus.CONFIRMED;
    }

    public boolean isWaitlisted() {
        return status == RegistrationStatus.WAITLISTED;
    }

    public boolean isCancelled() {
        return status == RegistrationStatus.CANCELLED;
    }

    public boolean hasFeedback() {
        return feedbackSubmittedAt != null;
    }

    /**
     * Move to CANCELLED. Callers decide whether a promotion follows.
     */
    public void cancel() {
        this.status = RegistrationStatus.CANCELLED;
        this.cancelledAt = Instant.now();
    }

    /**
     * Move a waitlisted registration into a freed seat.
     */
    public void promote() {
        this.status = RegistrationStatus.CONFIRMED;
        this.promotedAt = Instant.now();
    }

    public void markAttended(Instant when) {
        this.status = RegistrationStatus.ATTENDED;
        this.attendedAt = when;
    }

    public void markNoShow() {
        this.status = RegistrationStatus.NO_SHOW;
    }

    public void recordFeedback(String feedback, int rating) {
        this.feedback = feedback;
        this.rating = rating;
        this.feedbackSubmittedAt = Instant.now();
    }

    /**
     * Bring a cancelled registration back, at the end of the queue.
     *
     * @param newStatus CONFIRMED or WAITLISTED depending on capacity
     * @param notes     notes supplied with the new registration
     */
    public void reactivate(RegistrationStatus newStatus, String notes) {
        this.status = newStatus;
        this.notes = notes;
        this.registeredAt = Instant.now();
        this.cancelledAt = null;
        this.promotedAt = null;
    }

    /**
     * Registration status enum.
     */
    public enum RegistrationStatus {
        /**
         * Holds a seat.
         */
        CONFIRMED,

        /**
         * Queued for a seat, promoted oldest first.
         */
        WAITLISTED,

        /**
         * Terminal. Cancelled by the user or by a failed fee payment.
         */
        CANCELLED,

        /**
         * Organizer confirmed attendance after the event ended.
         */
        ATTENDED,

        /**
         * Organizer recorded that the user did not show up.
         */
        NO_SHOW
    }
}
