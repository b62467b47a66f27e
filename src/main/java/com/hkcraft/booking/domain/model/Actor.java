package com.hkcraft.booking.domain.model;

import java.util.Objects;

/**
 * Identity of whoever invokes an operation, as established by the security layer.
 * Services use it for ownership checks; they never read the security context themselves.
 *
 * @author Craft Booking Team
 */
public final class Actor {

    /**
     * Internal actor used by compensating actions such as payment-decline cancellation.
     */
    public static final Actor SYSTEM = new Actor("system", Role.SYSTEM);

    private final String userId;
    private final Role role;

    public Actor(String userId, Role role) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.role = Objects.requireNonNull(role, "role");
    }

    public static Actor user(String userId) {
        return new Actor(userId, Role.USER);
    }

    public static Actor admin(String userId) {
        return new Actor(userId, Role.ADMIN);
    }

    public String getUserId() {
        return userId;
    }

    public Role getRole() {
        return role;
    }

    /**
     * Admins and the system actor may act on any user's resources.
     */
    public boolean isPrivileged() {
        return role == Role.ADMIN || role == Role.SYSTEM;
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean canActFor(String ownerId) {
        return isPrivileged() || userId.equals(ownerId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Actor)) return false;
        Actor actor = (Actor) o;
        return userId.equals(actor.userId) && role == actor.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, role);
    }

    @Override
    public String toString() {
        return userId + "(" + role + ")";
    }

    public enum Role {
        USER,
        CRAFTSMAN,
        ORGANIZER,
        ADMIN,
        SYSTEM
    }
}
