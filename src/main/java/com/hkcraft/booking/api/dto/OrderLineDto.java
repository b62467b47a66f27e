package com.hkcraft.booking.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * One order line in a request.
 *
 * @author Craft Booking Team
 */
public class OrderLineDto {

    @NotBlank(message = "Product ID is required")
    private String productId;

    @Min(value = 1, message = "Quantity must be at least 1")
    private int quantity;

    private String customizationNotes;

    public OrderLineDto() {
    }

    public OrderLineDto(String productId, int quantity, String customizationNotes) {
        this.productId = productId;
        this.quantity = quantity;
        this.customizationNotes = customizationNotes;
    }

    // Getters and setters
    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }

    public String getCustomizationNotes() {
        return customizationNotes;
    }

    public void setCustomizationNotes(String customizationNotes) {
        this.customizationNotes = customizationNotes;
    }
}
