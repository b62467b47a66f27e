package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.Order;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for moving an order along fulfilment.
 *
 * @author Craft Booking Team
 */
public class OrderStatusRequest {

    @NotNull(message = "Status is required")
    private Order.OrderStatus status;

    public OrderStatusRequest() {
    }

    // Getters and setters
    public Order.OrderStatus getStatus() {
        return status;
    }

    public void setStatus(Order.OrderStatus status) {
        this.status = status;
    }
}
