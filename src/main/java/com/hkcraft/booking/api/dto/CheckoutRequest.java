package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.PaymentMethod;
import com.hkcraft.booking.domain.model.ShippingAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for placing and paying for an order in one call.
 *
 * The payment amount must equal the order total exactly.
 *
 * @author Craft Booking Team
 */
public class CheckoutRequest {

    @Valid
    private List<OrderLineDto> items = new ArrayList<>();

    private boolean fromCart;

    @NotNull(message = "Shipping address is required")
    private ShippingAddress shippingAddress;

    @NotNull(message = "Payment amount is required")
    @DecimalMin(value = "0.00", message = "Payment amount cannot be negative")
    private BigDecimal paymentAmount;

    @NotNull(message = "Payment method is required")
    private PaymentMethod paymentMethod;

    public CheckoutRequest() {
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

    public BigDecimal getPaymentAmount() {
        return paymentAmount;
    }

    public void setPaymentAmount(BigDecimal paymentAmount) {
        this.paymentAmount = paymentAmount;
    }

    public PaymentMethod getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(PaymentMethod paymentMethod) {
        this.paymentMethod = paymentMethod;
    }
}
