package com.gatehouse.backend.modules.user.application;

import java.util.List;

public record NewUser(
        String email,
        String username,
        String password,
        List<String> roles,
        boolean emailValidated,
        boolean acceptedTerms,
        boolean acceptedPrivacyPolicy
) {

    public NewUser {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
