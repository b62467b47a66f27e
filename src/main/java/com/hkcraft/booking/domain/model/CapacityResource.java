package com.hkcraft.booking.domain.model;

/**
 * A finite, countable resource that concurrent actors compete for.
 * Implemented by {@link ProductStock} and {@link CraftEvent}.
 *
 * @author Craft Booking Team
 */
public interface CapacityResource {

    ResourceType getResourceType();

    String getResourceId();

    /**
     * Units still claimable, or {@code null} when the resource is uncapped.
     */
    Integer getRemainingCapacity();
}
