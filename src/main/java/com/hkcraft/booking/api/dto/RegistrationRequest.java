package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.PaymentMethod;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering for an event. The payment method is required for paid events.
 *
 * @author Craft Booking Team
 */
public class RegistrationRequest {

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    private PaymentMethod paymentMethod;

    public RegistrationRequest() {
    }

    // Getters and setters
    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public PaymentMethod getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(PaymentMethod paymentMethod) {
        this.paymentMethod = paymentMethod;
    }
}
