package com.hkcraft.booking.exception;

/**
 * Exception thrown when cancelling an order that is already delivered or cancelled.
 *
 * @author Craft Booking Team
 */
public class OrderNotCancellableException extends RuntimeException {

    private final String orderId;
    private final String orderStatus;

    public OrderNotCancellableException(String orderId, String orderStatus) {
        super(String.format("Order %s cannot be cancelled (status: %s)", orderId, orderStatus));
        this.orderId = orderId;
        this.orderStatus = orderStatus;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getOrderStatus() {
        return orderStatus;
    }
}
