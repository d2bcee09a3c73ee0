package com.gatehouse.backend.modules.action.application;

public record AcceptInvitationRequest(
        String token,
        String email,
        String username,
        String password,
        boolean acceptedTerms,
        boolean acceptedPrivacyPolicy
) {
}
