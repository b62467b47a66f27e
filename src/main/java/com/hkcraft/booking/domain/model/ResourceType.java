package com.hkcraft.booking.domain.model;

/**
 * Closed set of allocatable resource kinds.
 * Every countable resource the engine guards belongs to exactly one of these.
 *
 * @author Craft Booking Team
 */
public enum ResourceType {

    /**
     * Product inventory units, tracked in the product_stock counter table.
     */
    PRODUCT_STOCK("Product"),

    /**
     * Seats of an event or course, bounded by maxParticipants.
     */
    EVENT_CAPACITY("Event");

    private final String displayName;

    ResourceType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
