package com.hkcraft.booking.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Authentication filter that trusts identity headers set by the gateway.
 *
 * Headers:
 * - X-User-Id: user identifier (required for authenticated requests)
 * - X-User-Role: USER, CRAFTSMAN, ORGANIZER or ADMIN (optional, defaults to USER)
 *
 * Unknown roles fall back to USER rather than granting anything extra.
 * The SYSTEM role is internal and can never be claimed through a header.
 *
 * @author Craft Booking Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private static final String DEFAULT_ROLE = "USER";
    private static final Set<String> ACCEPTED_ROLES = Set.of("USER", "CRAFTSMAN", "ORGANIZER", "ADMIN");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String role = resolveRole(request.getHeader(USER_ROLE_HEADER));

            List<SimpleGrantedAuthority> authorities = Collections.singletonList(
                new SimpleGrantedAuthority("ROLE_" + role)
            );

            UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(userId.trim(), null, authorities);

            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with role: {}", userId, role);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }

    private String resolveRole(String header) {
        if (header == null || header.isBlank()) {
            return DEFAULT_ROLE;
        }
        String role = header.trim().toUpperCase(Locale.ROOT);
        if (role.startsWith("ROLE_")) {
            role = role.substring("ROLE_".length());
        }
        if (!ACCEPTED_ROLES.contains(role)) {
            logger.warn("Ignoring unsupported role header value: {}", header);
            return DEFAULT_ROLE;
        }
        return role;
    }
}
