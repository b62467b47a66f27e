package com.hkcraft.booking.infrastructure.messaging;

import com.hkcraft.booking.infrastructure.messaging.events.Notification;

/**
 * Outbound user notifications. Delivery (email, push, in-app) happens elsewhere.
 *
 * Implementations must be fire-and-forget: they log delivery problems and
 * never throw back into the booking flow.
 *
 * @author Craft Booking Team
 */
public interface Notifier {

    void notify(String userId, Notification notification);
}
