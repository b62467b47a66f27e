package com.hkcraft.booking.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registration counts and feedback summary for one event.
 *
 * @author Craft Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventStats {

    private String eventId;
    private long total;
    private long confirmed;
    private long waitlisted;
    private long cancelled;
    private long attended;
    private long noShow;

    /**
     * Null when no rating has been submitted.
     */
    private Double averageRating;
    private long feedbackCount;

    /**
     * Null for events without a seat cap.
     */
    private Integer remainingSeats;
}
