package com.hkcraft.booking.security;

import com.hkcraft.booking.domain.model.Actor;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the caller's identity from the security context.
 * Controllers turn it into an {@link Actor}; services never touch the context.
 *
 * @author Craft Booking Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof String) {
                return (String) principal;
            }
        }

        return null;
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check (without ROLE_ prefix)
     * @return true if user has the role, false otherwise
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;

        return authentication.getAuthorities().stream()
            .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }

    /**
     * Build the actor for the current request.
     *
     * @return actor carrying the user id and role from the request headers
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static Actor currentActor() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        Actor.Role role = Actor.Role.USER;
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String name = authority.getAuthority();
            if (name.startsWith("ROLE_")) {
                role = toActorRole(name.substring("ROLE_".length()));
                break;
            }
        }
        return new Actor(userId, role);
    }

    private static Actor.Role toActorRole(String role) {
        switch (role) {
            case "ADMIN":
                return Actor.Role.ADMIN;
            case "CRAFTSMAN":
                return Actor.Role.CRAFTSMAN;
            case "ORGANIZER":
                return Actor.Role.ORGANIZER;
            default:
                return Actor.Role.USER;
        }
    }
}
