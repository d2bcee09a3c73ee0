package com.gatehouse.backend.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Principal attached to the security context once a session token has been resolved.
 */
public record AuthenticatedUser(
        UUID userId,
        String email,
        String username,
        List<String> roles,
        UUID organisationId,
        UUID establishmentId
) {

    public AuthenticatedUser {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
