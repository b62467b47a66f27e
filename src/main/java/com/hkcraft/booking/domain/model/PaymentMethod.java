package com.hkcraft.booking.domain.model;

/**
 * Payment methods accepted at checkout.
 *
 * @author Craft Booking Team
 */
public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    FPS,
    PAYME,
    ALIPAY_HK,
    WECHAT_PAY,
    OCTOPUS,
    BANK_TRANSFER
}
