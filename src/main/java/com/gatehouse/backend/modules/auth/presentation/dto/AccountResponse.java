package com.gatehouse.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.gatehouse.backend.modules.user.domain.AppUser;

public record AccountResponse(
        UUID id,
        String email,
        String username,
        List<String> roles,
        boolean emailValidated,
        boolean acceptedTerms,
        boolean acceptedPrivacyPolicy,
        UUID organisationId,
        UUID establishmentId
) {

    public static AccountResponse from(AppUser user) {
        return new AccountResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getRoleNames(),
                user.isEmailValidated(),
                user.isAcceptedTerms(),
                user.isAcceptedPrivacyPolicy(),
                user.getOrganisationId(),
                user.getEstablishmentId()
        );
    }
}
