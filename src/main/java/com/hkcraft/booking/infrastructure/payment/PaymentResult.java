package com.hkcraft.booking.infrastructure.payment;

import java.time.Instant;

/**
 * Outcome of a gateway call.
 *
 * @author Craft Booking Team
 */
public final class PaymentResult {

    private final boolean success;
    private final String transactionId;
    private final String declineCode;
    private final String declineReason;
    private final Instant processedAt;

    private PaymentResult(boolean success, String transactionId, String declineCode, String declineReason) {
        this.success = success;
        this.transactionId = transactionId;
        this.declineCode = declineCode;
        this.declineReason = declineReason;
        this.processedAt = Instant.now();
    }

    public static PaymentResult success(String transactionId) {
        return new PaymentResult(true, transactionId, null, null);
    }

    public static PaymentResult declined(String declineCode, String declineReason) {
        return new PaymentResult(false, null, declineCode, declineReason);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getDeclineCode() {
        return declineCode;
    }

    public String getDeclineReason() {
        return declineReason;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }
}
