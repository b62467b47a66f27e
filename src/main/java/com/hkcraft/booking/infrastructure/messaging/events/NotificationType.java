package com.hkcraft.booking.infrastructure.messaging.events;

/**
 * Kinds of notifications emitted by the booking engine.
 *
 * @author Craft Booking Team
 */
public enum NotificationType {
    ORDER_PLACED,
    ORDER_PAID,
    ORDER_CANCELLED,
    LOW_STOCK,
    REGISTRATION_RECEIVED,
    REGISTRATION_CONFIRMED,
    REGISTRATION_WAITLISTED,
    REGISTRATION_PROMOTED,
    REGISTRATION_CANCELLED
}
