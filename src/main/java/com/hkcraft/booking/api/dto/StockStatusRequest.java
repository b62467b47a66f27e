package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for withdrawing a product from sale or putting it back.
 *
 * @author Craft Booking Team
 */
public class StockStatusRequest {

    @NotNull(message = "Active flag is required")
    private Boolean active;

    public StockStatusRequest() {
    }

    // Getters and setters
    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }
}
