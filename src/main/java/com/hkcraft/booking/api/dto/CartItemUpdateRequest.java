package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.Min;

/**
 * Request DTO for changing a cart line. A quantity of 0 removes the line.
 *
 * @author Craft Booking Team
 */
public class CartItemUpdateRequest {

    @Min(value = 0, message = "Quantity cannot be negative")
    private int quantity;

    private String notes;

    public CartItemUpdateRequest() {
    }

    // Getters and setters
    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
