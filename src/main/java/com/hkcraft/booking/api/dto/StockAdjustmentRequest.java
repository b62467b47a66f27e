package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for restocking or correcting a product's stock.
 *
 * @author Craft Booking Team
 */
public class StockAdjustmentRequest {

    @NotNull(message = "Quantity is required")
    private Integer quantity;

    public StockAdjustmentRequest() {
    }

    // Getters and setters
    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }
}
