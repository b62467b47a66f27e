package com.hkcraft.booking.infrastructure.payment;

import com.hkcraft.booking.domain.model.PaymentMethod;

import java.math.BigDecimal;

/**
 * Payment provider abstraction.
 *
 * Only charge and refund are needed: orders are charged after the order row and
 * its stock claims are committed, and refunded after a paid order is cancelled.
 *
 * @author Craft Booking Team
 */
public interface PaymentGateway {

    /**
     * Charge the customer.
     *
     * @param amount    exact amount to charge
     * @param method    payment method
     * @param reference order or registration reference shown on the provider side
     * @return outcome; a decline is a result, not an exception
     */
    PaymentResult charge(BigDecimal amount, PaymentMethod method, String reference);

    /**
     * Refund a previous charge in full.
     *
     * @param transactionId transaction id returned by {@link #charge}
     * @param amount        amount to refund
     * @return outcome
     */
    PaymentResult refund(String transactionId, BigDecimal amount);
}
