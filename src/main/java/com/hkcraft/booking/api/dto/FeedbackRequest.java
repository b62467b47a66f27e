package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for post-event feedback. Rating range is checked by the registration service.
 *
 * @author Craft Booking Team
 */
public class FeedbackRequest {

    @Size(max = 2000, message = "Feedback must be at most 2000 characters")
    private String feedback;

    private Integer rating;

    public FeedbackRequest() {
    }

    // Getters and setters
    public String getFeedback() {
        return feedback;
    }

    public void setFeedback(String feedback) {
        this.feedback = feedback;
    }

    public Integer getRating() {
        return rating;
    }

    public void setRating(Integer rating) {
        this.rating = rating;
    }
}
