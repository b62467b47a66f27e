package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for creating the stock row of a new product.
 *
 * @author Craft Booking Team
 */
public class StockRegistrationRequest {

    @NotNull(message = "Initial quantity is required")
    @Min(value = 0, message = "Initial quantity cannot be negative")
    private Integer initialQuantity;

    @Min(value = 0, message = "Threshold cannot be negative")
    private Integer lowStockThreshold;

    public StockRegistrationRequest() {
    }

    // Getters and setters
    public Integer getInitialQuantity() {
        return initialQuantity;
    }

    public void setInitialQuantity(Integer initialQuantity) {
        this.initialQuantity = initialQuantity;
    }

    public Integer getLowStockThreshold() {
        return lowStockThreshold;
    }

    public void setLowStockThreshold(Integer lowStockThreshold) {
        this.lowStockThreshold = lowStockThreshold;
    }
}
