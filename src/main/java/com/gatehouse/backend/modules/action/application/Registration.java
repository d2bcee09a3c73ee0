package com.gatehouse.backend.modules.action.application;

/**
 * Self-service sign-up. Both agreements must be accepted.
 */
public record Registration(
        String email,
        String username,
        String password,
        boolean acceptedTerms,
        boolean acceptedPrivacyPolicy
) {
}
