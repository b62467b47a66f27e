package com.hkcraft.booking.exception;

/**
 * Exception thrown when the payment gateway declines a charge.
 * By the time this is raised the reserved stock or seat has already been given back.
 *
 * @author Craft Booking Team
 */
public class PaymentDeclinedException extends RuntimeException {

    private final String reference;
    private final String declineCode;
    private final String declineReason;

    public PaymentDeclinedException(String reference, String declineCode, String declineReason) {
        super(String.format("Payment for %s was declined: %s", reference, declineReason));
        this.reference = reference;
        this.declineCode = declineCode;
        this.declineReason = declineReason;
    }

    public String getReference() {
        return reference;
    }

    public String getDeclineCode() {
        return declineCode;
    }

    public String getDeclineReason() {
        return declineReason;
    }
}
