package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.ShippingAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating a PENDING order.
 * Either items are given, or fromCart is set and the stored cart is used.
 *
 * @author Craft Booking Team
 */
public class CreateOrderRequest {

    @Valid
    private List<OrderLineDto> items = new ArrayList<>();

    private boolean fromCart;

    @NotNull(message = "Shipping address is required")
    private ShippingAddress shippingAddress;

    public CreateOrderRequest() {
    }

    // Getters and setters
    public List<OrderLineDto> getItems() {
        return items;
    }

    public void setItems(List<OrderLineDto> items) {
        this.items = items;
    }

    public boolean isFromCart() {
        return fromCart;
    }

    public void setFromCart(boolean fromCart) {
        this.fromCart = fromCart;
    }

    public ShippingAddress getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(ShippingAddress shippingAddress) {
        this.shippingAddress = shippingAddress;
    }
}
