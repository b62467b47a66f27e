package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for recording attendance.
 *
 * @author Craft Booking Team
 */
public class AttendanceRequest {

    @NotBlank(message = "User ID is required")
    private String userId;

    @NotNull(message = "Attended flag is required")
    private Boolean attended;

    public AttendanceRequest() {
    }

    // Getters and setters
    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Boolean getAttended() {
        return attended;
    }

    public void setAttended(Boolean attended) {
        this.attended = attended;
    }
}
