package com.gatehouse.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.gatehouse.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<AuthenticatedUser> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static AuthenticatedUser getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> ProblemException.unauthorized("UNAUTHORIZED", "No authenticated user"));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
